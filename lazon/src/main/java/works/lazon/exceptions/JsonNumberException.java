package works.lazon.exceptions;

/**
 * A number in the input is malformed or can't be represented.
 */
public final class JsonNumberException extends JsonFormatException {
	public JsonNumberException(ErrorCode code, String message) {
		super(code, message);
	}

	public JsonNumberException(ErrorCode code, Throwable cause) {
		super(code, cause);
	}

	public JsonNumberException(ErrorCode code, String message, Throwable cause) {
		super(code, message, cause);
	}
}
