package works.lazon.exceptions;

/**
 * The API was used in a way it does not support,
 * like iterating a document whose parser is busy elsewhere.
 */
public final class JsonUsageException extends JsonException {
	public JsonUsageException(ErrorCode code, String message) {
		super(code, message);
	}

	public JsonUsageException(ErrorCode code, Throwable cause) {
		super(code, cause);
	}

	public JsonUsageException(ErrorCode code, String message, Throwable cause) {
		super(code, message, cause);
	}
}
