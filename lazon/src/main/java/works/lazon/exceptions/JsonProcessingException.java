package works.lazon.exceptions;

/**
 * An unexpected error has occurred during JSON processing, including I/O failures.
 * <p>
 * This does not necessarily indicate a problem with input JSON, but rather that
 * something unexpected has gone wrong.
 */
public final class JsonProcessingException extends JsonException {
	public JsonProcessingException(ErrorCode code, String message) {
		super(code, message);
	}

	public JsonProcessingException(ErrorCode code, Throwable cause) {
		super(code, cause);
	}

	public JsonProcessingException(ErrorCode code, String message, Throwable cause) {
		super(code, message, cause);
	}
}
