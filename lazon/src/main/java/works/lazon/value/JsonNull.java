package works.lazon.value;

import works.lazon.scan.JsonType;

public enum JsonNull implements JsonValue {
	INSTANCE;

	@Override
	public JsonType type() {
		return JsonType.NULL;
	}

	@Override
	public Object toJava() {
		return null;
	}

	@Override
	public String toString() {
		return "null";
	}
}
