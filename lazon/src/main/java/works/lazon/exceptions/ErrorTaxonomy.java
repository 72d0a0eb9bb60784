package works.lazon.exceptions;

/**
 * Translates engine result codes into exceptions of the appropriate category.
 */
public final class ErrorTaxonomy {
	private ErrorTaxonomy() {}

	public static JsonException exceptionFor(ErrorCode code) {
		return exceptionFor(code, code.message(), null);
	}

	/**
	 * @param detail appended to the code's own message, typically the offset at which the problem was found
	 */
	public static JsonException exceptionFor(ErrorCode code, String detail) {
		return exceptionFor(code, code.message() + " " + detail, null);
	}

	public static JsonException exceptionFor(ErrorCode code, String message, Throwable cause) {
		return switch (code.kind()) {
			case SYNTAX -> new JsonSyntaxException(code, message, cause);
			case NUMBER_FORMAT -> new JsonNumberException(code, message, cause);
			case EMPTY -> new JsonEmptyInputException(code, message, cause);
			case RESOURCE_LIMIT -> new JsonResourceException(code, message, cause);
			case NAVIGATION_MISS -> new JsonNavigationException(code, message, cause);
			case STRUCTURAL_MISUSE -> new JsonUsageException(code, message, cause);
			case PATH_SYNTAX -> new JsonPathException(code, message, cause);
			case IO, UNSUPPORTED_ARCHITECTURE, UNEXPECTED -> new JsonProcessingException(code, message, cause);
		};
	}

	/**
	 * @return true if lookup methods should report {@code code} as "absent" rather than throwing
	 */
	public static boolean isLookupMiss(ErrorCode code) {
		return code.kind() == ErrorKind.NAVIGATION_MISS;
	}

	public static boolean isLookupMiss(JsonException e) {
		return isLookupMiss(e.code());
	}

	/**
	 * The one condition after which nothing in the process should be trusted.
	 */
	public static boolean isFatal(ErrorCode code) {
		return code == ErrorCode.MEMALLOC;
	}

	public static JsonResourceException outOfMemory(OutOfMemoryError cause) {
		return new JsonResourceException(ErrorCode.MEMALLOC, cause);
	}
}
