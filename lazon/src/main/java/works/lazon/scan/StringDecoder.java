package works.lazon.scan;

import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorTaxonomy;
import works.lazon.exceptions.JsonException;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Unescapes the contents of a JSON string into an owned {@link String}.
 * <p>
 * Relies on the structural indexer having already established that the
 * string is closed, contains no unescaped control characters, and is valid UTF-8.
 */
final class StringDecoder {
	private final byte[] bytes;
	private int pos;

	private StringDecoder(byte[] bytes, int pos) {
		this.bytes = bytes;
		this.pos = pos;
	}

	/**
	 * @param start index in {@code bytes} of the first byte after the opening quote
	 */
	static String decode(byte[] bytes, int start) {
		// Do a scan to see if the string is all ASCII with no escape codes
		int currentPos = start;
		while (true) {
			byte b = bytes[currentPos];
			if (b == '"') {
				return new String(bytes, start, currentPos - start, US_ASCII);
			} else if (b == '\\' || b < 0) {
				// Found a byte that can't be directly copied as a char
				break;
			} else {
				currentPos++;
			}
		}

		// Otherwise fall back to the general case
		StringBuilder sb = new StringBuilder(currentPos - start + 16);
		for (int i = start; i < currentPos; i++) {
			sb.append((char) bytes[i]);
		}
		StringDecoder decoder = new StringDecoder(bytes, currentPos);
		int c;
		while ((c = decoder.nextChar()) != -1) {
			sb.appendCodePoint(c);
		}
		return sb.toString();
	}

	/**
	 * @return the next code point, or -1 at the closing quote
	 */
	private int nextChar() {
		int b = bytes[pos++];
		switch (b) {
			case '"' -> {
				return -1;
			}
			case '\\' -> {
				int esc = bytes[pos++];
				if (esc == 'u') {
					return decodeUnicodeEscapeSequence();
				}
				return decodeEscapeChar(esc);
			}
		}

		if ((b & 0x80) == 0) {
			// ASCII fast path
			return b;
		} else {
			return decodeUtf8Char(b);
		}
	}

	private int decodeUnicodeEscapeSequence() {
		int value = decodeUnicodeEscape();
		if (Character.isHighSurrogate((char) value)) {
			if (bytes[pos] != '\\' || bytes[pos + 1] != 'u') {
				throw stringError("Unpaired high surrogate \\u" + Integer.toHexString(value));
			}
			pos += 2;
			int low = decodeUnicodeEscape();
			if (!Character.isLowSurrogate((char) low)) {
				throw stringError("Invalid low surrogate \\u" + Integer.toHexString(low));
			}
			return Character.toCodePoint((char) value, (char) low);
		} else if (Character.isLowSurrogate((char) value)) {
			throw stringError("Unpaired low surrogate \\u" + Integer.toHexString(value));
		}
		return value;
	}

	private int decodeUnicodeEscape() {
		int value = 0;
		for (int i = 0; i < 4; i++) {
			int b = bytes[pos++];
			value <<= 4;
			int digitValue = Character.digit(b, 16);
			if (digitValue == -1) {
				throw stringError("Invalid hex digit in Unicode escape: " + (char) b);
			}
			value |= digitValue;
		}
		return value;
	}

	private static int decodeEscapeChar(int b) {
		return switch (b) {
			case '"' -> '"';
			case '\\' -> '\\';
			case '/' -> '/';
			case 'b' -> '\b';
			case 'f' -> '\f';
			case 'n' -> '\n';
			case 'r' -> '\r';
			case 't' -> '\t';
			default -> throw stringError("Invalid escape: \\" + (char) b);
		};
	}

	private int decodeUtf8Char(int firstByte) {
		// The first byte tells us how long a sequence we're dealing with
		int codePoint;
		int sequenceLength;
		if ((firstByte & 0xE0) == 0xC0) {
			sequenceLength = 2;
			codePoint = firstByte & 0x1F;
		} else if ((firstByte & 0xF0) == 0xE0) {
			sequenceLength = 3;
			codePoint = firstByte & 0x0F;
		} else if ((firstByte & 0xF8) == 0xF0) {
			sequenceLength = 4;
			codePoint = firstByte & 0x07;
		} else {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.UTF8_ERROR, "(invalid start byte " + (firstByte & 0xFF) + ")");
		}

		for (int i = 1; i < sequenceLength; i++) {
			int bx = bytes[pos++];
			if ((bx & 0xC0) != 0x80) {
				throw ErrorTaxonomy.exceptionFor(ErrorCode.UTF8_ERROR, "(invalid continuation byte " + (bx & 0xFF) + ")");
			}
			codePoint = (codePoint << 6) | (bx & 0x3F);
		}
		return codePoint;
	}

	private static JsonException stringError(String detail) {
		return ErrorTaxonomy.exceptionFor(ErrorCode.STRING_ERROR, "(" + detail + ")");
	}
}
