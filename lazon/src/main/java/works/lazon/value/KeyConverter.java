package works.lazon.value;

/**
 * Turns a decoded object key into the string that will be stored in a {@link JsonObject}.
 */
@FunctionalInterface
public interface KeyConverter {
	String convert(String key);

	KeyConverter STRINGS = key -> key;

	/**
	 * Canonicalizes keys so that repeated keys across many objects share one instance.
	 */
	KeyConverter INTERNED = String::intern;

	static KeyConverter forSymbolizedKeys(boolean symbolizeKeys) {
		return symbolizeKeys ? INTERNED : STRINGS;
	}
}
