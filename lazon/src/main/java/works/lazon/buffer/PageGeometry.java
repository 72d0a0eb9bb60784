package works.lazon.buffer;

import static works.lazon.buffer.PaddedBuffer.PADDING;

/**
 * Arithmetic about where a byte range sits relative to page boundaries.
 */
record PageGeometry(int pageSize) {
	PageGeometry {
		assert Integer.bitCount(pageSize) == 1;
	}

	/**
	 * @return true if reading {@link PaddedBuffer#PADDING} bytes past the end of the given range
	 * stays within the page that holds the range's last byte
	 */
	boolean paddingStaysOnLastPage(long address, int length) {
		long end = address + length - 1;
		long offsetInPage = end & (pageSize - 1);
		return offsetInPage + PADDING < pageSize;
	}

	/**
	 * The JVM can't read past the end of an array no matter what pages are mapped,
	 * so an in-place view is only usable if the array itself covers the padding.
	 */
	static boolean storageCoversPadding(byte[] storage, int length) {
		return storage.length - (long) length >= PADDING;
	}
}
