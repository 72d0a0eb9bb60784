package works.lazon.scan;

public enum NumberType {
	/**
	 * Fits in a {@code long}.
	 */
	SIGNED_INTEGER,

	/**
	 * Larger than {@link Long#MAX_VALUE} but fits in 64 bits unsigned.
	 */
	UNSIGNED_INTEGER,

	/**
	 * Too large for 64 bits. Kept as decimal text.
	 */
	BIG_INTEGER,

	FLOATING_POINT,
}
