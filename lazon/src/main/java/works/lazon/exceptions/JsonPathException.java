package works.lazon.exceptions;

/**
 * A JSON pointer or path expression is malformed.
 */
public final class JsonPathException extends JsonException {
	public JsonPathException(ErrorCode code, String message) {
		super(code, message);
	}

	public JsonPathException(ErrorCode code, Throwable cause) {
		super(code, cause);
	}

	public JsonPathException(ErrorCode code, String message, Throwable cause) {
		super(code, message, cause);
	}
}
