package works.lazon.scan;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lazon.buffer.BufferView;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorTaxonomy;
import works.lazon.exceptions.JsonException;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * A forward-only cursor over the tokens found by {@link ScanEngine#iterate}.
 * <p>
 * Validates structure only as far as it is read:
 * skipping over a value checks nothing but bracket balance.
 * <p>
 * Only valid until the engine's next {@link ScanEngine#iterate iterate} or
 * {@link ScanEngine#allocate allocate} call; see {@link #isValid()}.
 */
public final class JsonIterator {
	private final ScanEngine engine;
	private final BufferView view;
	private final byte[] bytes;
	private final int base;
	private final int length;
	private final int[] structurals;
	private final int count;
	private final long generation;
	private final int maxBigIntegerDigits;

	/**
	 * Index into {@link #structurals} of the next token to read.
	 */
	private int index = 0;

	JsonIterator(ScanEngine engine, BufferView view, int[] structurals, int count, long generation, int maxBigIntegerDigits) {
		this.engine = engine;
		this.view = view;
		this.bytes = view.bytes();
		this.base = view.offset();
		this.length = view.length();
		this.structurals = structurals;
		this.count = count;
		this.generation = generation;
		this.maxBigIntegerDigits = maxBigIntegerDigits;
	}

	public long generation() {
		return generation;
	}

	/**
	 * @return false if the engine has since been used for something else,
	 * in which case nothing else on this object may be called
	 */
	public boolean isValid() {
		return engine.generation() == generation;
	}

	public BufferView view() {
		return view;
	}

	/**
	 * @return an opaque position that can be passed to {@link #seek}
	 */
	public int checkpoint() {
		return index;
	}

	public void seek(int checkpoint) {
		assert 0 <= checkpoint && checkpoint <= count;
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("seek {} -> {} |{}|", index, checkpoint, previewString(checkpoint));
		}
		index = checkpoint;
	}

	public void rewind() {
		seek(0);
	}

	public boolean isAtRoot() {
		return index == 0;
	}

	public boolean atEnd() {
		return index >= count;
	}

	/**
	 * Byte offset of the next token in the input.
	 */
	public int currentOffset() {
		return structurals[index];
	}

	/**
	 * @return the first byte of the next token, or -1 at end of input
	 */
	private int peekByte() {
		return index < count ? bytes[base + structurals[index]] & 0xFF : -1;
	}

	/**
	 * @throws works.lazon.exceptions.JsonSyntaxException if the next token can't begin a value
	 */
	public JsonType peekType() {
		return switch (Token.startingWith(peekByte())) {
			case START_OBJECT -> JsonType.OBJECT;
			case START_ARRAY -> JsonType.ARRAY;
			case STRING -> JsonType.STRING;
			case NUMBER -> JsonType.NUMBER;
			case TRUE, FALSE -> JsonType.BOOLEAN;
			case NULL -> JsonType.NULL;
			case END_TEXT -> throw incomplete();
			default -> throw tapeError("Expected a value");
		};
	}

	public boolean isScalar() {
		JsonType type = peekType();
		return type != JsonType.OBJECT && type != JsonType.ARRAY;
	}

	/**
	 * Consumes the opening brace.
	 *
	 * @return true if the object has a field, in which case the iterator is positioned at its key;
	 * false if it's empty, in which case the closing brace has also been consumed
	 * @throws works.lazon.exceptions.JsonNavigationException with {@link ErrorCode#INCORRECT_TYPE} if the next value is not an object
	 */
	public boolean enterObject() {
		if (peekType() != JsonType.OBJECT) {
			throw incorrectType("object");
		}
		index++;
		if (peekByte() == '}') {
			index++;
			return false;
		}
		return true;
	}

	/**
	 * Consumes a key and the colon that follows it, leaving the iterator at the field's value.
	 */
	public String fieldKey() {
		int b = peekByte();
		if (b != '"') {
			throw (b == -1) ? incomplete() : tapeError("Expected a field name");
		}
		String key = StringDecoder.decode(bytes, base + structurals[index] + 1);
		index++;
		b = peekByte();
		if (b != ':') {
			throw (b == -1) ? incomplete() : tapeError("Expected ':'");
		}
		index++;
		return key;
	}

	/**
	 * Call after consuming a field's value.
	 *
	 * @return true if there's another field, in which case the iterator is positioned at its key;
	 * false if the closing brace was consumed
	 */
	public boolean nextField() {
		return switch (peekByte()) {
			case ',' -> {
				index++;
				yield true;
			}
			case '}' -> {
				index++;
				yield false;
			}
			case -1 -> throw incomplete();
			default -> throw tapeError("Expected ',' or '}'");
		};
	}

	/**
	 * Consumes the opening bracket.
	 *
	 * @return true if the array has an element, in which case the iterator is positioned at it;
	 * false if it's empty, in which case the closing bracket has also been consumed
	 */
	public boolean enterArray() {
		if (peekType() != JsonType.ARRAY) {
			throw incorrectType("array");
		}
		index++;
		if (peekByte() == ']') {
			index++;
			return false;
		}
		return true;
	}

	public boolean nextElement() {
		return switch (peekByte()) {
			case ',' -> {
				index++;
				yield true;
			}
			case ']' -> {
				index++;
				yield false;
			}
			case -1 -> throw incomplete();
			default -> throw tapeError("Expected ',' or ']'");
		};
	}

	/**
	 * Moves past the next value without examining its contents.
	 */
	public void skipValue() {
		int b = peekByte();
		if (b == '{' || b == '[') {
			int nesting = 0;
			do {
				switch (peekByte()) {
					case '{', '[' -> nesting++;
					case '}', ']' -> nesting--;
					case -1 -> throw incomplete();
					default -> {}
				}
				index++;
			} while (nesting > 0);
		} else {
			peekType(); // Validates that this is a value
			index++;
		}
	}

	public String readString() {
		if (peekType() != JsonType.STRING) {
			throw incorrectType("string");
		}
		String result = StringDecoder.decode(bytes, base + structurals[index] + 1);
		index++;
		return result;
	}

	public boolean readBoolean() {
		if (peekType() != JsonType.BOOLEAN) {
			throw incorrectType("boolean");
		}
		int pos = structurals[index];
		switch (Token.startingWith(peekByte())) {
			case TRUE -> {
				// Reading four bytes may run into the padding, but never past it
				boolean matches = (int) INT_VIEW.get(bytes, base + pos) == TRUE_BYTES;
				checkAtom(matches, Token.TRUE, pos);
				return true;
			}
			case FALSE -> {
				boolean matches = (int) INT_VIEW.get(bytes, base + pos + 1) == ALSE_BYTES;
				checkAtom(matches, Token.FALSE, pos);
				return false;
			}
			default -> throw new AssertionError("Unexpected boolean token at offset " + pos);
		}
	}

	public void readNull() {
		if (peekType() != JsonType.NULL) {
			throw incorrectType("null");
		}
		int pos = structurals[index];
		boolean matches = (int) INT_VIEW.get(bytes, base + pos) == NULL_BYTES;
		checkAtom(matches, Token.NULL, pos);
	}

	public ScannedNumber readNumber() {
		if (peekType() != JsonType.NUMBER) {
			throw incorrectType("number");
		}
		ScannedNumber result = NumberParser.parse(bytes, base, structurals[index], length, maxBigIntegerDigits);
		index++;
		return result;
	}

	/**
	 * @throws works.lazon.exceptions.JsonSyntaxException with {@link ErrorCode#TRAILING_CONTENT} if any tokens remain
	 */
	public void expectEnd() {
		if (index < count) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.TRAILING_CONTENT, "at offset " + structurals[index]);
		}
	}

	private void checkAtom(boolean bytesMatch, Token atom, int pos) {
		int end = pos + atom.fixedRepresentation().length();
		if (!bytesMatch || end > length || !isTerminatorAt(end)) {
			throw ErrorTaxonomy.exceptionFor(atom.atomError(), "at offset " + pos);
		}
		index++;
	}

	private boolean isTerminatorAt(int pos) {
		return pos >= length || Util.isScalarTerminator(bytes[base + pos] & 0xFF);
	}

	private JsonException incomplete() {
		return ErrorTaxonomy.exceptionFor(ErrorCode.INCOMPLETE_ARRAY_OR_OBJECT, "at offset " + length);
	}

	private JsonException tapeError(String detail) {
		return ErrorTaxonomy.exceptionFor(ErrorCode.TAPE_ERROR, "(" + detail + " at offset " + structurals[index] + ")");
	}

	private JsonException incorrectType(String expected) {
		return ErrorTaxonomy.exceptionFor(ErrorCode.INCORRECT_TYPE, "(expected " + expected + " at offset " + structurals[index] + ")");
	}

	String previewString(int checkpoint) {
		int start = structurals[checkpoint];
		return new String(bytes, base + start, Math.min(20, length - start), US_ASCII);
	}

	@Override
	public String toString() {
		return "JsonIterator(index=" + index + "/" + count + ", generation=" + generation + ")";
	}

	private static final VarHandle INT_VIEW = MethodHandles.byteArrayViewVarHandle(int[].class, ByteOrder.LITTLE_ENDIAN);
	private static final int TRUE_BYTES = asInt("true");
	private static final int ALSE_BYTES = asInt("alse");
	private static final int NULL_BYTES = asInt("null");

	private static int asInt(String fourChars) {
		return (int) INT_VIEW.get(fourChars.getBytes(US_ASCII), 0);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonIterator.class);
}
