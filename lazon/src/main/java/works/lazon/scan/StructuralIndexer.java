package works.lazon.scan;

import works.lazon.buffer.BufferView;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorTaxonomy;

/**
 * The first pass over the input.
 * Records the offset of every token, and rejects input that is not UTF-8,
 * has unclosed strings or control characters inside strings, or nests too deeply.
 * <p>
 * Does not check how tokens are arranged; that is left to {@link JsonIterator},
 * which checks only as much as the caller actually reads.
 */
final class StructuralIndexer {
	private StructuralIndexer() {}

	/**
	 * Fills {@code structurals} with the offsets of the tokens in {@code view},
	 * followed by a sentinel equal to the input length.
	 *
	 * @return the number of tokens, not counting the sentinel
	 */
	static int index(BufferView view, int[] structurals, int maxDepth) {
		byte[] bytes = view.bytes();
		int base = view.offset();
		int length = view.length();

		int invalid = Utf8Validator.firstInvalid(bytes, base, length);
		if (invalid != -1) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.UTF8_ERROR, "at offset " + invalid);
		}

		int count = 0;
		int depth = 0;
		int i = 0;
		while (i < length) {
			int b = bytes[base + i] & 0xFF;
			if (Util.fast_isWhitespace(b)) {
				i++;
				continue;
			}
			structurals[count++] = i;
			switch (Token.startingWith(b)) {
				case START_OBJECT, START_ARRAY -> {
					if (++depth > maxDepth) {
						throw ErrorTaxonomy.exceptionFor(ErrorCode.DEPTH_ERROR, "(limit " + maxDepth + " at offset " + i + ")");
					}
					i++;
				}
				case END_OBJECT, END_ARRAY -> {
					depth--;
					i++;
				}
				case COMMA, COLON -> i++;
				case STRING -> i = skipString(bytes, base, length, i);
				default -> i = skipScalar(bytes, base, length, i);
			}
		}
		structurals[count] = length;
		return count;
	}

	/**
	 * @return the offset just past the closing quote
	 */
	private static int skipString(byte[] bytes, int base, int length, int openingQuote) {
		int i = openingQuote + 1;
		while (i < length) {
			int b = bytes[base + i] & 0xFF;
			if (b == '"') {
				return i + 1;
			} else if (b == '\\') {
				i += 2;
			} else if (b < 0x20) {
				throw ErrorTaxonomy.exceptionFor(ErrorCode.UNESCAPED_CHARS, "at offset " + i);
			} else {
				i++;
			}
		}
		throw ErrorTaxonomy.exceptionFor(ErrorCode.UNCLOSED_STRING, "(opened at offset " + openingQuote + ")");
	}

	/**
	 * Numbers, literals, and garbage all extend to the next whitespace, structural character, or quote.
	 */
	private static int skipScalar(byte[] bytes, int base, int length, int start) {
		int i = start + 1;
		while (i < length) {
			int b = bytes[base + i] & 0xFF;
			if (Util.isScalarTerminator(b) || b == '"') {
				return i;
			}
			i++;
		}
		return i;
	}
}
