package works.lazon.exceptions;

/**
 * The category an {@link ErrorCode} belongs to.
 * <p>
 * Only {@link #NAVIGATION_MISS} is ever swallowed by lookup methods;
 * every other kind propagates to the caller.
 */
public enum ErrorKind {
	SYNTAX,
	RESOURCE_LIMIT,
	NUMBER_FORMAT,

	/**
	 * A field or index that isn't there, or a container of the wrong type
	 * encountered during a lookup. Not an error in lookup contexts.
	 */
	NAVIGATION_MISS,

	/**
	 * Programmer error: the API was used in a way it doesn't support.
	 */
	STRUCTURAL_MISUSE,

	PATH_SYNTAX,
	IO,
	UNSUPPORTED_ARCHITECTURE,
	UNEXPECTED,
	EMPTY,
}
