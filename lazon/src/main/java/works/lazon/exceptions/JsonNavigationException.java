package works.lazon.exceptions;

/**
 * A lookup found nothing.
 * <p>
 * Lookup methods normally report this as an empty result;
 * this is thrown only where the caller asked for a value unconditionally.
 */
public final class JsonNavigationException extends JsonException {
	public JsonNavigationException(ErrorCode code, String message) {
		super(code, message);
	}

	public JsonNavigationException(ErrorCode code, Throwable cause) {
		super(code, cause);
	}

	public JsonNavigationException(ErrorCode code, String message, Throwable cause) {
		super(code, message, cause);
	}
}
