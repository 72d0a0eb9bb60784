package works.lazon.codec;

import java.io.ByteArrayOutputStream;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorTaxonomy;
import works.lazon.scan.Utf8Validator;
import works.lazon.value.JsonArray;
import works.lazon.value.JsonBigInteger;
import works.lazon.value.JsonBoolean;
import works.lazon.value.JsonDouble;
import works.lazon.value.JsonInteger;
import works.lazon.value.JsonNull;
import works.lazon.value.JsonObject;
import works.lazon.value.JsonString;
import works.lazon.value.JsonUnsigned;
import works.lazon.value.JsonValue;

import static java.nio.charset.StandardCharsets.UTF_8;
import static works.lazon.buffer.PaddedBuffer.PADDING;
import static works.lazon.scan.Token.END_ARRAY;
import static works.lazon.scan.Token.END_OBJECT;
import static works.lazon.scan.Token.FALSE;
import static works.lazon.scan.Token.NULL;
import static works.lazon.scan.Token.START_ARRAY;
import static works.lazon.scan.Token.START_OBJECT;
import static works.lazon.scan.Token.TRUE;

/**
 * Emits compact UTF-8 JSON text for {@link JsonValue}s and plain Java objects.
 * <p>
 * Plain objects are mapped as follows:
 * {@link Map} to an object with {@link String#valueOf stringified} keys;
 * {@link Iterable} and arrays to an array;
 * {@link CharSequence} to a string;
 * {@link Boolean} and the JDK's {@link Number} types to themselves;
 * {@link Enum} to its name;
 * {@code null} to {@code null};
 * and anything else to the string form of its {@link Object#toString() toString}.
 * <p>
 * Non-finite numbers become {@code null}.
 */
public final class JsonEncoder {
	/**
	 * The largest output we'll produce, so that it can always be parsed back.
	 */
	public static final int MAX_OUTPUT = Integer.MAX_VALUE - PADDING;

	private final int maxDepth;
	private final int maxOutput;

	public JsonEncoder(int maxDepth) {
		this(maxDepth, MAX_OUTPUT);
	}

	JsonEncoder(int maxDepth, int maxOutput) {
		if (maxDepth <= 0) {
			throw new IllegalArgumentException("Max depth must be positive: " + maxDepth);
		}
		this.maxDepth = maxDepth;
		this.maxOutput = maxOutput;
	}

	/**
	 * @throws works.lazon.exceptions.JsonSyntaxException with {@link ErrorCode#UTF8_ERROR}
	 * if any string contains an unpaired surrogate
	 * @throws works.lazon.exceptions.JsonResourceException if the output is too large or too deeply nested
	 * @throws IllegalArgumentException if {@code value} contains a {@link Number} of a type this encoder doesn't know
	 */
	public byte[] encode(Object value) {
		LOGGER.trace("Encoding {}", (value == null) ? "null" : value.getClass());
		Session session = new Session();
		session.generateAny(value, 0);
		byte[] result = session.out.toByteArray();

		// Strings are written without per-fragment checks; this is where bad ones are caught
		int invalid = Utf8Validator.firstInvalid(result, 0, result.length);
		if (invalid != -1) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.UTF8_ERROR, "invalid utf-8", null);
		}
		return result;
	}

	public String encodeToString(Object value) {
		return new String(encode(value), UTF_8);
	}

	final class Session {
		final ByteArrayOutputStream out = new ByteArrayOutputStream();

		void generateAny(Object value, int depth) {
			if (value == null) {
				print(NULL.fixedRepresentation());
			} else if (value instanceof JsonValue json) {
				generateJsonValue(json, depth);
			} else if (value instanceof CharSequence s) {
				generateString(s.toString());
			} else if (value instanceof Boolean b) {
				print((b ? TRUE : FALSE).fixedRepresentation());
			} else if (value instanceof Number n) {
				generateNumber(n);
			} else if (value instanceof Map<?, ?> map) {
				generateMap(map, depth);
			} else if (value instanceof Iterable<?> iterable) {
				generateIterable(iterable, depth);
			} else if (value.getClass().isArray()) {
				generateArray(value, depth);
			} else if (value instanceof Enum<?> e) {
				generateString(e.name());
			} else {
				generateString(value.toString());
			}
		}

		private void generateJsonValue(JsonValue value, int depth) {
			if (value instanceof JsonNull) {
				print(NULL.fixedRepresentation());
			} else if (value instanceof JsonBoolean b) {
				print((b.value() ? TRUE : FALSE).fixedRepresentation());
			} else if (value instanceof JsonInteger i) {
				print(Long.toString(i.value()));
			} else if (value instanceof JsonUnsigned u) {
				print(Long.toUnsignedString(u.bits()));
			} else if (value instanceof JsonDouble d) {
				generateDouble(d.value());
			} else if (value instanceof JsonBigInteger big) {
				print(big.digits());
			} else if (value instanceof JsonString s) {
				generateString(s.value());
			} else if (value instanceof JsonArray array) {
				generateIterable(array.elements(), depth);
			} else if (value instanceof JsonObject object) {
				generateMap(object.members(), depth);
			} else {
				throw new AssertionError("Unexpected JsonValue: " + value.getClass());
			}
		}

		private void generateNumber(Number n) {
			if (n instanceof Double || n instanceof Float) {
				generateDouble(n.doubleValue(), n.toString());
			} else if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
				|| n instanceof BigInteger) {
				print(n.toString());
			} else if (n instanceof AtomicInteger || n instanceof AtomicLong
				|| n instanceof LongAdder || n instanceof LongAccumulator) {
				print(Long.toString(n.longValue()));
			} else if (n instanceof DoubleAdder || n instanceof DoubleAccumulator) {
				generateDouble(n.doubleValue());
			} else if (n instanceof BigDecimal big) {
				print(big.toString());
			} else {
				throw new IllegalArgumentException("Unsupported Number type: " + n.getClass().getName());
			}
		}

		private void generateDouble(double d) {
			generateDouble(d, Double.toString(d));
		}

		private void generateDouble(double d, String text) {
			if (Double.isFinite(d)) {
				print(text);
			} else {
				print(NULL.fixedRepresentation());
			}
		}

		private void generateMap(Map<?, ?> map, int depth) {
			enter(depth);
			print(START_OBJECT.fixedRepresentation());
			String sep = "";
			for (var entry : map.entrySet()) {
				print(sep);
				sep = ",";
				generateString(String.valueOf(entry.getKey()));
				print(":");
				generateAny(entry.getValue(), depth + 1);
			}
			print(END_OBJECT.fixedRepresentation());
		}

		private void generateIterable(Iterable<?> iterable, int depth) {
			enter(depth);
			print(START_ARRAY.fixedRepresentation());
			String sep = "";
			for (Object element : iterable) {
				print(sep);
				sep = ",";
				generateAny(element, depth + 1);
			}
			print(END_ARRAY.fixedRepresentation());
		}

		private void generateArray(Object array, int depth) {
			enter(depth);
			print(START_ARRAY.fixedRepresentation());
			int length = Array.getLength(array);
			for (int i = 0; i < length; i++) {
				if (i > 0) {
					print(",");
				}
				generateAny(Array.get(array, i), depth + 1);
			}
			print(END_ARRAY.fixedRepresentation());
		}

		private void enter(int depth) {
			if (depth >= maxDepth) {
				throw ErrorTaxonomy.exceptionFor(ErrorCode.DEPTH_ERROR, "(encoding more than " + maxDepth + " levels)");
			}
		}

		/**
		 * Surrogates are encoded one {@code char} at a time, so an unpaired one
		 * yields bytes that the final UTF-8 check rejects.
		 */
		private void generateString(String s) {
			reserve(1);
			out.write('"');
			for (int i = 0; i < s.length(); i++) {
				char c = s.charAt(i);
				switch (c) {
					case '"' -> print("\\\"");
					case '\\' -> print("\\\\");
					case '\b' -> print("\\b");
					case '\f' -> print("\\f");
					case '\n' -> print("\\n");
					case '\r' -> print("\\r");
					case '\t' -> print("\\t");
					default -> {
						if (c < 0x20) {
							print("\\u00");
							reserve(2);
							out.write(HEX_DIGITS[c >> 4]);
							out.write(HEX_DIGITS[c & 0xF]);
						} else if (c < 0x80) {
							reserve(1);
							out.write(c);
						} else if (c < 0x800) {
							reserve(2);
							out.write(0xC0 | (c >> 6));
							out.write(0x80 | (c & 0x3F));
						} else if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
							int cp = Character.toCodePoint(c, s.charAt(++i));
							reserve(4);
							out.write(0xF0 | (cp >> 18));
							out.write(0x80 | ((cp >> 12) & 0x3F));
							out.write(0x80 | ((cp >> 6) & 0x3F));
							out.write(0x80 | (cp & 0x3F));
						} else {
							reserve(3);
							out.write(0xE0 | (c >> 12));
							out.write(0x80 | ((c >> 6) & 0x3F));
							out.write(0x80 | (c & 0x3F));
						}
					}
				}
			}
			reserve(1);
			out.write('"');
		}

		/**
		 * For ASCII text only.
		 */
		private void print(String ascii) {
			int length = ascii.length();
			reserve(length);
			for (int i = 0; i < length; i++) {
				out.write(ascii.charAt(i));
			}
		}

		private void reserve(int count) {
			if (out.size() > maxOutput - count) {
				throw ErrorTaxonomy.exceptionFor(ErrorCode.OUT_OF_CAPACITY, "(output exceeds " + maxOutput + " bytes)");
			}
		}
	}

	private static final byte[] HEX_DIGITS = "0123456789abcdef".getBytes(UTF_8);
	private static final Logger LOGGER = LoggerFactory.getLogger(JsonEncoder.class);
}
