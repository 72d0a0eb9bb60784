package works.lazon.exceptions;

/**
 * The input text is not valid JSON.
 */
public final class JsonSyntaxException extends JsonFormatException {
	public JsonSyntaxException(ErrorCode code, String message) {
		super(code, message);
	}

	public JsonSyntaxException(ErrorCode code, Throwable cause) {
		super(code, cause);
	}

	public JsonSyntaxException(ErrorCode code, String message, Throwable cause) {
		super(code, message, cause);
	}
}
