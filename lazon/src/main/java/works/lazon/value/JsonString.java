package works.lazon.value;

import works.lazon.scan.JsonType;

import static java.util.Objects.requireNonNull;

public record JsonString(String value) implements JsonValue {
	public JsonString {
		requireNonNull(value);
	}

	@Override
	public JsonType type() {
		return JsonType.STRING;
	}

	@Override
	public Object toJava() {
		return value;
	}

	@Override
	public String toString() {
		return '"' + value + '"';
	}
}
