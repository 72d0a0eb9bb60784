package works.lazon.scan;

import java.util.stream.LongStream;

public class Util {
	private static final long SEPARATOR_CHARS = LongStream
		.of(0x20, 0x0A, 0x0D, 0x09, ',', ':')
		.map(n -> 1L << n)
		.sum();

	private static final long WHITESPACE_CHARS = LongStream
		.of(0x20, 0x0A, 0x0D, 0x09)
		.map(n -> 1L << n)
		.sum();

	/**
	 * True for whitespace, comma, and colon.
	 * Brackets are excluded because they don't fit in the 64-bit mask.
	 *
	 * @param b an unsigned byte value, or -1 for end of input
	 */
	public static boolean fast_isSeparator(int b) {
		return fast_isIn(SEPARATOR_CHARS, b);
	}

	public static boolean fast_isWhitespace(int b) {
		boolean result = fast_isIn(WHITESPACE_CHARS, b);
		assert result == (Token.startingWith(b) == Token.WHITESPACE);
		return result;
	}

	private static boolean fast_isIn(long mask, int b) {
		// The position to check in the mask
		long bit = 1L << b;

		// Zero if definitely not in the set
		// Can have false positives
		long bitIsSet = mask & bit;

		// All ones if b is outside the range the mask covers
		long isNegative = (long)b >> 63; // Note: -1 represents end of input
		long isTooBig = (63L - b) >> 63;

		long answer = bitIsSet & ~(isNegative | isTooBig);
		return answer != 0;
	}

	/**
	 * @return true if {@code b} may directly follow a number or a literal
	 */
	public static boolean isScalarTerminator(int b) {
		return fast_isSeparator(b) || b == '}' || b == ']' || b == '{' || b == '[';
	}

	public static boolean isNumberChar(int b) {
		return (b >= '0' && b <= '9') || b == '.' || b == '-' || b == '+' || b == 'e' || b == 'E';
	}

	public static boolean isDigit(int b) {
		return b >= '0' && b <= '9';
	}
}
