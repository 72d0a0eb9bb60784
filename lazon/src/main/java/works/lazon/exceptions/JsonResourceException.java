package works.lazon.exceptions;

/**
 * A limit was hit: nesting depth, parser capacity, buffer padding, or memory.
 * <p>
 * When the code is {@link ErrorCode#MEMALLOC}, the cause is the original {@link OutOfMemoryError}.
 */
public final class JsonResourceException extends JsonException {
	public JsonResourceException(ErrorCode code, String message) {
		super(code, message);
	}

	public JsonResourceException(ErrorCode code, Throwable cause) {
		super(code, cause);
	}

	public JsonResourceException(ErrorCode code, String message, Throwable cause) {
		super(code, message, cause);
	}
}
