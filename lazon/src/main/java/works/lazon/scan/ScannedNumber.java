package works.lazon.scan;

/**
 * A number as classified by {@link NumberParser}.
 *
 * @param bits        the value for {@link NumberType#SIGNED_INTEGER SIGNED_INTEGER},
 *                    or the unsigned bit pattern for {@link NumberType#UNSIGNED_INTEGER UNSIGNED_INTEGER}
 * @param doubleValue the value for {@link NumberType#FLOATING_POINT FLOATING_POINT}
 * @param text        the raw token text for {@link NumberType#BIG_INTEGER BIG_INTEGER}; otherwise null
 */
public record ScannedNumber(
	NumberType type,
	long bits,
	double doubleValue,
	String text
) {
	static ScannedNumber signed(long value) {
		return new ScannedNumber(NumberType.SIGNED_INTEGER, value, 0, null);
	}

	static ScannedNumber unsigned(long bits) {
		return new ScannedNumber(NumberType.UNSIGNED_INTEGER, bits, 0, null);
	}

	static ScannedNumber floatingPoint(double value) {
		return new ScannedNumber(NumberType.FLOATING_POINT, 0, value, null);
	}

	static ScannedNumber bigInteger(String text) {
		return new ScannedNumber(NumberType.BIG_INTEGER, 0, 0, text);
	}
}
