package works.lazon.scan;

import java.math.BigInteger;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorTaxonomy;
import works.lazon.exceptions.JsonException;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Validates and classifies a JSON number token.
 */
final class NumberParser {
	private static final BigInteger UNSIGNED_LIMIT = BigInteger.ONE.shiftLeft(64);
	private static final BigInteger SIGNED_MIN = BigInteger.valueOf(Long.MIN_VALUE);

	/**
	 * Any run of this many digits or fewer fits in a long.
	 */
	private static final int SAFE_DIGITS = 18;

	private NumberParser() {}

	/**
	 * @param base   index in {@code bytes} of input offset zero
	 * @param start  input offset of the first character of the number
	 * @param length length of the input
	 */
	static ScannedNumber parse(byte[] bytes, int base, int start, int length, int maxBigIntegerDigits) {
		int end = start;
		while (end < length && Util.isNumberChar(bytes[base + end])) {
			end++;
		}
		if (end < length && !Util.isScalarTerminator(bytes[base + end] & 0xFF)) {
			throw numberError("Invalid character after number", start);
		}

		boolean isInteger = validate(bytes, base, start, end);
		if (!isInteger) {
			String text = new String(bytes, base + start, end - start, US_ASCII);
			double value = Double.parseDouble(text);
			if (Double.isInfinite(value)) {
				throw ErrorTaxonomy.exceptionFor(ErrorCode.NUMBER_OUT_OF_RANGE, "at offset " + start);
			}
			return ScannedNumber.floatingPoint(value);
		}

		boolean negative = bytes[base + start] == '-';
		int firstDigit = negative ? start + 1 : start;
		int digits = end - firstDigit;
		if (digits <= SAFE_DIGITS) {
			long value = 0;
			for (int i = firstDigit; i < end; i++) {
				value = value * 10 + (bytes[base + i] - '0');
			}
			return ScannedNumber.signed(negative ? -value : value);
		}

		if (digits > maxBigIntegerDigits) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.BIGINT_ERROR, "(" + digits + " digits at offset " + start + ")");
		}
		String text = new String(bytes, base + start, end - start, US_ASCII);
		BigInteger value = new BigInteger(text);
		if (negative) {
			if (value.compareTo(SIGNED_MIN) >= 0) {
				return ScannedNumber.signed(value.longValue());
			}
		} else if (value.bitLength() < 64) {
			return ScannedNumber.signed(value.longValue());
		} else if (value.compareTo(UNSIGNED_LIMIT) < 0) {
			return ScannedNumber.unsigned(value.longValue());
		}
		return ScannedNumber.bigInteger(text);
	}

	/**
	 * @return true if the number has neither a fraction nor an exponent
	 * @throws works.lazon.exceptions.JsonNumberException if the characters don't form a JSON number
	 */
	static boolean validate(byte[] bytes, int base, int start, int end) {
		// Regex is insanely slow
		int i = start;
		if (at(bytes, base, i, end) == '-') {
			i++;
		}
		switch (at(bytes, base, i, end)) {
			case '0' -> {
				i++;
			}
			case '1', '2', '3', '4', '5', '6', '7', '8', '9' -> {
				do {
					i++;
				} while (Util.isDigit(at(bytes, base, i, end)));
			}
			default -> throw numberError("Invalid leading character in number", start);
		}
		if (i == end) {
			return true;
		}
		boolean isInteger = true;
		if (at(bytes, base, i, end) == '.') {
			isInteger = false;
			i++;
			if (!Util.isDigit(at(bytes, base, i, end))) {
				throw numberError("Invalid fractional part in number", start);
			}
			do {
				i++;
			} while (Util.isDigit(at(bytes, base, i, end)));
		}
		int c = at(bytes, base, i, end);
		if (c == 'e' || c == 'E') {
			isInteger = false;
			i++;
			c = at(bytes, base, i, end);
			if (c == '+' || c == '-') {
				i++;
			}
			if (!Util.isDigit(at(bytes, base, i, end))) {
				throw numberError("Invalid exponent part in number", start);
			}
			do {
				i++;
			} while (Util.isDigit(at(bytes, base, i, end)));
		}
		if (i != end) {
			throw numberError("Invalid trailing characters in number", start);
		}
		return isInteger;
	}

	/**
	 * @return the byte at position {@code i}, or -1 past {@code end}
	 */
	private static int at(byte[] bytes, int base, int i, int end) {
		return i < end ? bytes[base + i] : -1;
	}

	private static JsonException numberError(String detail, int offset) {
		return ErrorTaxonomy.exceptionFor(ErrorCode.NUMBER_ERROR, "(" + detail + " at offset " + offset + ")");
	}
}
