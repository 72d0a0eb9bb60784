package works.lazon.value;

import works.lazon.scan.JsonType;

public record JsonBoolean(boolean value) implements JsonValue {
	public static final JsonBoolean TRUE = new JsonBoolean(true);
	public static final JsonBoolean FALSE = new JsonBoolean(false);

	@Override
	public JsonType type() {
		return JsonType.BOOLEAN;
	}

	@Override
	public Object toJava() {
		return value;
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}
