package works.lazon.exceptions;

import static java.util.Objects.requireNonNull;

/**
 * Base class of everything this library throws.
 * Every instance carries the {@link ErrorCode} reported by the engine.
 */
public sealed abstract class JsonException extends RuntimeException permits
	JsonFormatException,
	JsonResourceException,
	JsonNavigationException,
	JsonUsageException,
	JsonPathException,
	JsonProcessingException
{
	private final ErrorCode code;

	protected JsonException(ErrorCode code, String message) {
		super(message);
		this.code = requireNonNull(code);
	}

	protected JsonException(ErrorCode code, Throwable cause) {
		super(code.message(), cause);
		this.code = requireNonNull(code);
	}

	protected JsonException(ErrorCode code, String message, Throwable cause) {
		super(message, cause);
		this.code = requireNonNull(code);
	}

	public ErrorCode code() {
		return code;
	}

	public ErrorKind kind() {
		return code.kind();
	}

	/**
	 * @return an exception of the same class and code as {@code exception},
	 * with {@code context} prepended to its message.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends JsonException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		return (T) ErrorTaxonomy.exceptionFor(exception.code(), newMessage, exception);
	}
}
