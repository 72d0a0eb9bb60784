package works.lazon.buffer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorTaxonomy;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Bytes owned by this library, always followed by at least {@link #PADDING} spare bytes.
 */
public final class PaddedBuffer {
	/**
	 * The number of bytes past the logical end of the input that the scanner is allowed to read.
	 */
	public static final int PADDING = 64;

	private final byte[] bytes;
	private final int length;

	private PaddedBuffer(byte[] bytes, int length) {
		assert bytes.length - length >= PADDING;
		this.bytes = bytes;
		this.length = length;
	}

	public static PaddedBuffer copyOf(byte[] source) {
		return copyOf(source, 0, source.length);
	}

	public static PaddedBuffer copyOf(byte[] source, int offset, int length) {
		byte[] bytes = allocate(length);
		System.arraycopy(source, offset, bytes, 0, length);
		return new PaddedBuffer(bytes, length);
	}

	public static PaddedBuffer utf8(String text) {
		return copyOf(text.getBytes(UTF_8));
	}

	/**
	 * Reads an entire file into a new padded buffer.
	 */
	public static PaddedBuffer load(Path path) {
		try (InputStream in = Files.newInputStream(path)) {
			long size = Files.size(path);
			if (size > Integer.MAX_VALUE - PADDING) {
				throw ErrorTaxonomy.exceptionFor(ErrorCode.OVERSIZE_INPUT, "(" + size + " bytes in " + path + ")");
			}
			byte[] bytes = allocate((int) size);
			int length = 0;
			// The file can change size between the size() call and the read
			while (true) {
				if (length == bytes.length - PADDING) {
					int next = in.read();
					if (next == -1) {
						break;
					}
					bytes = grow(bytes, length);
					bytes[length++] = (byte) next;
				}
				int n = in.read(bytes, length, bytes.length - PADDING - length);
				if (n == -1) {
					break;
				}
				length += n;
			}
			LOGGER.debug("Loaded {} bytes from {}", length, path);
			return new PaddedBuffer(bytes, length);
		} catch (IOException e) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.IO_ERROR, ErrorCode.IO_ERROR.message() + ": " + path, e);
		}
	}

	public int length() {
		return length;
	}

	public int capacity() {
		return bytes.length;
	}

	public BufferView view() {
		return new BufferView(this, bytes, 0, length, bytes.length);
	}

	@Override
	public String toString() {
		return "PaddedBuffer(" + length + " bytes)";
	}

	/**
	 * @throws works.lazon.exceptions.JsonResourceException if the padded size doesn't fit in an array,
	 * or if the JVM can't allocate it
	 */
	static byte[] allocate(int length) {
		int paddedLength = BufferManager.paddedLength(length);
		try {
			return new byte[paddedLength];
		} catch (OutOfMemoryError e) {
			throw ErrorTaxonomy.outOfMemory(e);
		}
	}

	private static byte[] grow(byte[] bytes, int length) {
		int newLength = (int) Math.min(Integer.MAX_VALUE - PADDING, 2L * length + 1);
		if (newLength <= length) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.OVERSIZE_INPUT, "(file grew past " + length + " bytes)");
		}
		byte[] result = allocate(newLength);
		System.arraycopy(bytes, 0, result, 0, length);
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PaddedBuffer.class);
}
