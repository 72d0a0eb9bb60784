package works.lazon.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import works.lazon.scan.JsonType;

/**
 * @param members in document order. When a key appears more than once,
 *                the last value wins but the key keeps its first position.
 */
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {
	public JsonObject {
		members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
	}

	public Optional<JsonValue> get(String key) {
		return Optional.ofNullable(members.get(key));
	}

	public int size() {
		return members.size();
	}

	@Override
	public JsonType type() {
		return JsonType.OBJECT;
	}

	@Override
	public Object toJava() {
		Map<String, Object> result = new LinkedHashMap<>();
		members.forEach((k, v) -> result.put(k, v.toJava()));
		return Collections.unmodifiableMap(result);
	}

	@Override
	public String toString() {
		return members.toString();
	}
}
