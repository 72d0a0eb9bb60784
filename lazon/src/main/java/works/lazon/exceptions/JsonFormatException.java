package works.lazon.exceptions;

/**
 * The JSON input text is invalid.
 */
public sealed abstract class JsonFormatException extends JsonException permits
	JsonSyntaxException,
	JsonNumberException,
	JsonEmptyInputException
{
	protected JsonFormatException(ErrorCode code, String message) {
		super(code, message);
	}

	protected JsonFormatException(ErrorCode code, Throwable cause) {
		super(code, cause);
	}

	protected JsonFormatException(ErrorCode code, String message, Throwable cause) {
		super(code, message, cause);
	}
}
