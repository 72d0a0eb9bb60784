package works.lazon.exceptions;

import static works.lazon.exceptions.ErrorKind.EMPTY;
import static works.lazon.exceptions.ErrorKind.IO;
import static works.lazon.exceptions.ErrorKind.NAVIGATION_MISS;
import static works.lazon.exceptions.ErrorKind.NUMBER_FORMAT;
import static works.lazon.exceptions.ErrorKind.PATH_SYNTAX;
import static works.lazon.exceptions.ErrorKind.RESOURCE_LIMIT;
import static works.lazon.exceptions.ErrorKind.STRUCTURAL_MISUSE;
import static works.lazon.exceptions.ErrorKind.SYNTAX;
import static works.lazon.exceptions.ErrorKind.UNEXPECTED;
import static works.lazon.exceptions.ErrorKind.UNSUPPORTED_ARCHITECTURE;

/**
 * The fixed set of outcomes the scanning engine can report.
 */
public enum ErrorCode {
	TAPE_ERROR(SYNTAX, "The JSON document has an improper structure: missing or superfluous commas, braces, or keys"),
	STRING_ERROR(SYNTAX, "Problem while parsing a string"),
	UNCLOSED_STRING(SYNTAX, "A string is opened, but never closed"),
	UNESCAPED_CHARS(SYNTAX, "Within strings, some characters must be escaped; we found unescaped characters"),
	UTF8_ERROR(SYNTAX, "The input is not valid UTF-8"),
	T_ATOM_ERROR(SYNTAX, "Problem while parsing an atom starting with the letter 't'"),
	F_ATOM_ERROR(SYNTAX, "Problem while parsing an atom starting with the letter 'f'"),
	N_ATOM_ERROR(SYNTAX, "Problem while parsing an atom starting with the letter 'n'"),
	TRAILING_CONTENT(SYNTAX, "Unexpected trailing content after the JSON document"),
	INCOMPLETE_ARRAY_OR_OBJECT(SYNTAX, "The document ends early: an array or object is never closed"),

	DEPTH_ERROR(RESOURCE_LIMIT, "The JSON document is too deep (too many nested objects and arrays)"),
	CAPACITY(RESOURCE_LIMIT, "This parser can't support a document that big"),
	OUT_OF_CAPACITY(RESOURCE_LIMIT, "The capacity was exceeded; the result cannot be produced"),
	INSUFFICIENT_PADDING(RESOURCE_LIMIT, "The input buffer does not have enough padding for safe scanning"),
	OVERSIZE_INPUT(RESOURCE_LIMIT, "JSON input too large for padding"),
	MEMALLOC(RESOURCE_LIMIT, "Error allocating memory; we are most likely out of memory"),

	NUMBER_ERROR(NUMBER_FORMAT, "Problem while parsing a number"),
	BIGINT_ERROR(NUMBER_FORMAT, "The integer is too large to be represented"),
	NUMBER_OUT_OF_RANGE(NUMBER_FORMAT, "The number does not fit in a finite double"),

	NO_SUCH_FIELD(NAVIGATION_MISS, "The JSON field referenced does not exist in this object"),
	INDEX_OUT_OF_BOUNDS(NAVIGATION_MISS, "The JSON element does not have an array at that index"),
	OUT_OF_BOUNDS(NAVIGATION_MISS, "Attempted to access a location outside of the document"),
	INCORRECT_TYPE(NAVIGATION_MISS, "The JSON element does not have the requested type"),

	UNINITIALIZED(STRUCTURAL_MISUSE, "The parser has not been initialized"),
	PARSER_IN_USE(STRUCTURAL_MISUSE, "The parser is already in use by another iteration"),
	SCALAR_DOCUMENT_AS_VALUE(STRUCTURAL_MISUSE, "A scalar document cannot be iterated as an array or object"),
	OUT_OF_ORDER_ITERATION(STRUCTURAL_MISUSE, "Objects and arrays must be iterated in document order"),
	DOCUMENT_DEAD(STRUCTURAL_MISUSE, "The document could not be rehydrated; call reiterate() to restart it"),

	INVALID_JSON_POINTER(PATH_SYNTAX, "Invalid JSON pointer syntax"),
	INVALID_URI_FRAGMENT(PATH_SYNTAX, "Invalid URI fragment"),

	IO_ERROR(IO, "Error reading the file"),
	UNSUPPORTED_ARCHITECTURE_ERROR(UNSUPPORTED_ARCHITECTURE, "The scanning implementation is not supported on this platform"),
	UNEXPECTED_ERROR(UNEXPECTED, "Unexpected error, consider reporting this problem as a bug"),
	EMPTY_INPUT(EMPTY, "The input is empty or contains only whitespace"),
	;

	private final ErrorKind kind;
	private final String message;

	ErrorCode(ErrorKind kind, String message) {
		this.kind = kind;
		this.message = message;
	}

	public ErrorKind kind() {
		return kind;
	}

	public String message() {
		return message;
	}
}
