package works.lazon.document;

/**
 * The liveness of a {@link LazyDocument}.
 */
public enum DocumentState {
	/**
	 * Freshly iterated; nothing has been read since.
	 */
	FRESH,

	/**
	 * Some read has occurred.
	 */
	ACTIVE,

	/**
	 * The parser has since been used for something else, so the cursor no longer describes this document.
	 * The next read will rehydrate it.
	 */
	STALE,

	/**
	 * Rehydration failed. Reads are refused until {@link LazyDocument#reiterate()} succeeds.
	 */
	DEAD;

	public boolean isAlive() {
		return this == FRESH || this == ACTIVE;
	}
}
