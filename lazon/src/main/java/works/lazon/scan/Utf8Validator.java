package works.lazon.scan;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;

/**
 * Checks that bytes are well-formed UTF-8:
 * no overlong encodings, no surrogates, nothing above U+10FFFF,
 * and no truncated sequences.
 */
public final class Utf8Validator {
	private Utf8Validator() {}

	public static boolean isValid(byte[] bytes, int offset, int length) {
		return firstInvalid(bytes, offset, length) == -1;
	}

	/**
	 * @return the index, relative to {@code offset}, of the first byte of the first
	 * ill-formed sequence, or -1 if there is none
	 */
	public static int firstInvalid(byte[] bytes, int offset, int length) {
		int i = 0;
		while (i < length) {
			// ASCII fast path, eight bytes at a time
			while (i + 8 <= length && (readLong(bytes, offset + i) & 0x8080808080808080L) == 0) {
				i += 8;
			}
			if (i >= length) {
				break;
			}
			int b = bytes[offset + i] & 0xFF;
			if (b < 0x80) {
				i++;
				continue;
			}
			int sequenceLength;
			int min2 = 0x80;
			int max2 = 0xBF;
			if (b >= 0xC2 && b <= 0xDF) {
				sequenceLength = 2;
			} else if (b >= 0xE0 && b <= 0xEF) {
				sequenceLength = 3;
				if (b == 0xE0) {
					min2 = 0xA0; // overlong
				} else if (b == 0xED) {
					max2 = 0x9F; // surrogates
				}
			} else if (b >= 0xF0 && b <= 0xF4) {
				sequenceLength = 4;
				if (b == 0xF0) {
					min2 = 0x90; // overlong
				} else if (b == 0xF4) {
					max2 = 0x8F; // above U+10FFFF
				}
			} else {
				return i;
			}
			if (i + sequenceLength > length) {
				return i;
			}
			int b2 = bytes[offset + i + 1] & 0xFF;
			if (b2 < min2 || b2 > max2) {
				return i;
			}
			for (int k = 2; k < sequenceLength; k++) {
				if ((bytes[offset + i + k] & 0xC0) != 0x80) {
					return i;
				}
			}
			i += sequenceLength;
		}
		return -1;
	}

	private static long readLong(byte[] bytes, int index) {
		return (long) LONG_VIEW.get(bytes, index);
	}

	private static final VarHandle LONG_VIEW =
		MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.LITTLE_ENDIAN);
}
