package works.lazon.scan;

/**
 * The type of a JSON value, as determined by the scanner from its first byte.
 */
public enum JsonType {
	OBJECT,
	ARRAY,
	STRING,
	NUMBER,
	BOOLEAN,
	NULL,
}
