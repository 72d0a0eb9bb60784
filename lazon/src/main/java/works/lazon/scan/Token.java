package works.lazon.scan;

import works.lazon.exceptions.ErrorCode;

/**
 * The kind of JSON element that begins with a given byte.
 */
public enum Token {
	END_TEXT,
	NULL,
	FALSE,
	TRUE,
	NUMBER,
	START_OBJECT,
	END_OBJECT,
	START_ARRAY,
	END_ARRAY,

	/**
	 * Can be a member name or a string value.
	 * We don't distinguish at the token level.
	 */
	STRING,

	COMMA,
	COLON,
	WHITESPACE,

	/**
	 * A byte that can't begin any JSON token.
	 * The indexer still records where it is, so the error can be reported
	 * when (and if) something tries to read it.
	 */
	ERROR;

	/**
	 * @param b an unsigned byte value, or -1 for end of input
	 */
	public static Token startingWith(int b) {
		return switch (b) {
			case -1 -> END_TEXT;
			case 'n' -> NULL;
			case 'f' -> FALSE;
			case 't' -> TRUE;
			case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '-' -> NUMBER;
			case '{' -> START_OBJECT;
			case '}' -> END_OBJECT;
			case '[' -> START_ARRAY;
			case ']' -> END_ARRAY;
			case '"' -> STRING;
			case ',' -> COMMA;
			case ':' -> COLON;
			case 0x20, 0x0A, 0x0D, 0x09 -> WHITESPACE;
			default -> ERROR;
		};
	}

	/**
	 * @return true for tokens that are always represented in JSON with the same sequence of characters
	 */
	public boolean hasFixedRepresentation() {
		return switch (this) {
			case END_TEXT,
				 NULL, FALSE, TRUE,
				 START_OBJECT, END_OBJECT, START_ARRAY, END_ARRAY,
				 COMMA, COLON ->
				true;
			default ->
				false;
		};
	}

	public String fixedRepresentation() {
		return switch (this) {
			case END_TEXT -> "";
			case NULL -> "null";
			case FALSE -> "false";
			case TRUE -> "true";
			case START_OBJECT -> "{";
			case END_OBJECT -> "}";
			case START_ARRAY -> "[";
			case END_ARRAY -> "]";
			case COMMA -> ",";
			case COLON -> ":";
			default ->
				throw new IllegalArgumentException("Token has no fixed representation: " + this);
		};
	}

	/**
	 * @return true for tokens that the structural index records on their own,
	 * without scanning ahead to find where they end
	 */
	public boolean isStructural() {
		return switch (this) {
			case START_OBJECT, END_OBJECT, START_ARRAY, END_ARRAY, COMMA, COLON ->
				true;
			default ->
				false;
		};
	}

	/**
	 * @return the error to report when a token starting like this one
	 * turns out not to be spelled correctly
	 */
	ErrorCode atomError() {
		return switch (this) {
			case TRUE -> ErrorCode.T_ATOM_ERROR;
			case FALSE -> ErrorCode.F_ATOM_ERROR;
			case NULL -> ErrorCode.N_ATOM_ERROR;
			default ->
				throw new IllegalArgumentException("Not an atom: " + this);
		};
	}
}
