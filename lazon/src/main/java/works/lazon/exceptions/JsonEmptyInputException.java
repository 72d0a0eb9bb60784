package works.lazon.exceptions;

/**
 * The input contains no JSON value at all.
 */
public final class JsonEmptyInputException extends JsonFormatException {
	public JsonEmptyInputException(ErrorCode code, String message) {
		super(code, message);
	}

	public JsonEmptyInputException(ErrorCode code, Throwable cause) {
		super(code, cause);
	}

	public JsonEmptyInputException(ErrorCode code, String message, Throwable cause) {
		super(code, message, cause);
	}
}
