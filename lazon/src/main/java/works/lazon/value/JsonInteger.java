package works.lazon.value;

import works.lazon.scan.JsonType;

public record JsonInteger(long value) implements JsonValue {
	@Override
	public JsonType type() {
		return JsonType.NUMBER;
	}

	@Override
	public Object toJava() {
		return value;
	}

	@Override
	public String toString() {
		return Long.toString(value);
	}
}
