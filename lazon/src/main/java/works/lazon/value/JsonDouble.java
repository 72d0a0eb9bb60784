package works.lazon.value;

import works.lazon.scan.JsonType;

public record JsonDouble(double value) implements JsonValue {
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
		return Double.toString(value);
	}
}
