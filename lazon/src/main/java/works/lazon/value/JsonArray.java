package works.lazon.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import works.lazon.scan.JsonType;

public record JsonArray(List<JsonValue> elements) implements JsonValue {
	public JsonArray {
		elements = List.copyOf(elements);
	}

	public JsonValue get(int index) {
		return elements.get(index);
	}

	public int size() {
		return elements.size();
	}

	@Override
	public JsonType type() {
		return JsonType.ARRAY;
	}

	@Override
	public Object toJava() {
		List<Object> result = new ArrayList<>(elements.size());
		for (JsonValue element : elements) {
			result.add(element.toJava());
		}
		return Collections.unmodifiableList(result);
	}

	@Override
	public String toString() {
		return elements.toString();
	}
}
