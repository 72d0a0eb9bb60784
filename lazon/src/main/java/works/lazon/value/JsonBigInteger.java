package works.lazon.value;

import java.math.BigInteger;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorTaxonomy;
import works.lazon.scan.JsonType;

import static java.util.Objects.requireNonNull;

/**
 * An integer too large for 64 bits, kept as the decimal text it was read from.
 *
 * @param digits an optional {@code -} followed by one or more ASCII digits
 */
public record JsonBigInteger(String digits) implements JsonValue {
	/**
	 * @throws works.lazon.exceptions.JsonNumberException with {@link ErrorCode#BIGINT_ERROR}
	 * if {@code digits} isn't a decimal integer
	 */
	public JsonBigInteger {
		requireNonNull(digits);
		if (!isDecimalInteger(digits)) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.BIGINT_ERROR, "(not a decimal integer: \"" + digits + "\")");
		}
	}

	public BigInteger bigIntegerValue() {
		return new BigInteger(digits);
	}

	@Override
	public JsonType type() {
		return JsonType.NUMBER;
	}

	@Override
	public Object toJava() {
		return bigIntegerValue();
	}

	@Override
	public String toString() {
		return digits;
	}

	private static boolean isDecimalInteger(String s) {
		int start = s.startsWith("-") ? 1 : 0;
		if (start == s.length()) {
			return false;
		}
		for (int i = start; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		return true;
	}
}
