package works.lazon.value;

import java.math.BigInteger;
import works.lazon.scan.JsonType;

/**
 * An integer between 2<sup>63</sup> and 2<sup>64</sup>-1 inclusive.
 *
 * @param bits the value's two's-complement bit pattern, which is negative as a {@code long}
 */
public record JsonUnsigned(long bits) implements JsonValue {
	public JsonUnsigned {
		if (bits >= 0) {
			throw new IllegalArgumentException("Value fits in a signed long; use JsonInteger: " + bits);
		}
	}

	public BigInteger bigIntegerValue() {
		return new BigInteger(Long.toUnsignedString(bits));
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
		return Long.toUnsignedString(bits);
	}
}
