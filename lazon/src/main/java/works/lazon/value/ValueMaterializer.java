package works.lazon.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import works.lazon.scan.JsonIterator;
import works.lazon.scan.ScannedNumber;

import static java.util.Objects.requireNonNull;

/**
 * Reads one complete value from a {@link JsonIterator} into a {@link JsonValue} tree.
 * <p>
 * Any error aborts the whole conversion; nothing partially built escapes.
 * On error, the iterator is left wherever the problem was found.
 */
public final class ValueMaterializer {
	private final KeyConverter keyConverter;

	public ValueMaterializer(KeyConverter keyConverter) {
		this.keyConverter = requireNonNull(keyConverter);
	}

	public static ValueMaterializer withStringKeys() {
		return STRING_KEYS;
	}

	/**
	 * Consumes the next value from {@code iterator}.
	 */
	public JsonValue materialize(JsonIterator iterator) {
		return switch (iterator.peekType()) {
			case OBJECT -> materializeObject(iterator);
			case ARRAY -> materializeArray(iterator);
			case STRING -> new JsonString(iterator.readString());
			case NUMBER -> materializeNumber(iterator.readNumber());
			case BOOLEAN -> JsonValue.of(iterator.readBoolean());
			case NULL -> {
				iterator.readNull();
				yield JsonNull.INSTANCE;
			}
		};
	}

	/**
	 * Consumes the document's root value and verifies nothing follows it.
	 */
	public JsonValue materializeDocument(JsonIterator iterator) {
		JsonValue result = materialize(iterator);
		iterator.expectEnd();
		return result;
	}

	public String convertKey(String key) {
		return keyConverter.convert(key);
	}

	private JsonObject materializeObject(JsonIterator iterator) {
		Map<String, JsonValue> members = new LinkedHashMap<>();
		if (iterator.enterObject()) {
			do {
				String key = keyConverter.convert(iterator.fieldKey());
				members.put(key, materialize(iterator));
			} while (iterator.nextField());
		}
		return new JsonObject(members);
	}

	private JsonArray materializeArray(JsonIterator iterator) {
		List<JsonValue> elements = new ArrayList<>();
		if (iterator.enterArray()) {
			do {
				elements.add(materialize(iterator));
			} while (iterator.nextElement());
		}
		return new JsonArray(elements);
	}

	/**
	 * The engine has already decided which kind of number this is; we never second-guess it.
	 */
	static JsonValue materializeNumber(ScannedNumber number) {
		return switch (number.type()) {
			case SIGNED_INTEGER -> new JsonInteger(number.bits());
			case UNSIGNED_INTEGER -> new JsonUnsigned(number.bits());
			case BIG_INTEGER -> new JsonBigInteger(number.text());
			case FLOATING_POINT -> new JsonDouble(number.doubleValue());
		};
	}

	private static final ValueMaterializer STRING_KEYS = new ValueMaterializer(KeyConverter.STRINGS);
}
