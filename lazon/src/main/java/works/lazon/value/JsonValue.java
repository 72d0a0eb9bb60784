package works.lazon.value;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import works.lazon.scan.JsonType;

/**
 * A fully materialized JSON value.
 * Every implementation is immutable and owns its contents.
 */
public sealed interface JsonValue permits
	JsonNull,
	JsonBoolean,
	JsonInteger,
	JsonUnsigned,
	JsonDouble,
	JsonBigInteger,
	JsonString,
	JsonArray,
	JsonObject
{
	JsonType type();

	/**
	 * @return the closest plain Java equivalent:
	 * {@code null}, {@link Boolean}, {@link Long}, {@link BigInteger}, {@link Double},
	 * {@link String}, {@link List}, or {@link Map}
	 */
	Object toJava();

	static JsonValue nullValue() {
		return JsonNull.INSTANCE;
	}

	static JsonValue of(boolean value) {
		return value ? JsonBoolean.TRUE : JsonBoolean.FALSE;
	}

	static JsonValue of(long value) {
		return new JsonInteger(value);
	}

	static JsonValue of(double value) {
		return new JsonDouble(value);
	}

	static JsonValue of(String value) {
		return new JsonString(value);
	}

	/**
	 * @return the smallest representation that holds {@code value} exactly
	 */
	static JsonValue of(BigInteger value) {
		if (value.bitLength() < 64) {
			return new JsonInteger(value.longValue());
		} else if (value.signum() > 0 && value.bitLength() == 64) {
			return new JsonUnsigned(value.longValue());
		} else {
			return new JsonBigInteger(value.toString());
		}
	}

	static JsonArray array(JsonValue... elements) {
		return new JsonArray(List.of(elements));
	}
}
