package works.lazon.buffer;

import static works.lazon.buffer.PaddedBuffer.PADDING;

/**
 * A window onto bytes that the scanner may read.
 *
 * @param owner    the object whose lifetime governs {@code bytes}.
 *                 Held so that the bytes stay reachable for as long as this view is.
 * @param bytes    the backing array; not necessarily owned by this library
 * @param offset   index in {@code bytes} of the first byte of input
 * @param length   number of bytes of input
 * @param capacity number of bytes starting at {@code offset} that may be read,
 *                 including the padding past {@code length}
 */
public record BufferView(
	Object owner,
	byte[] bytes,
	int offset,
	int length,
	int capacity
) {
	public BufferView {
		if (offset < 0 || length < 0 || capacity < length || offset + (long) capacity > bytes.length) {
			throw new IllegalArgumentException("Invalid view: offset=" + offset
				+ " length=" + length
				+ " capacity=" + capacity
				+ " storage=" + bytes.length);
		}
	}

	/**
	 * @return true if the scanner can safely read {@link PaddedBuffer#PADDING} bytes past the end
	 */
	public boolean isPadded() {
		return capacity - length >= PADDING;
	}

	/**
	 * @param position relative to {@link #offset}; may extend into the padding
	 */
	public byte byteAt(int position) {
		return bytes[offset + position];
	}

	/**
	 * @return true if this view reads the owner's bytes directly rather than a private copy
	 */
	public boolean isBorrowed() {
		return owner instanceof HostBytes;
	}

	@Override
	public String toString() {
		return "BufferView(" + owner.getClass().getSimpleName()
			+ ", offset=" + offset
			+ ", length=" + length
			+ ", capacity=" + capacity
			+ ")";
	}
}
