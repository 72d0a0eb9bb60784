package works.lazon.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.lazon.Json;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.JsonNumberException;
import works.lazon.exceptions.JsonResourceException;
import works.lazon.exceptions.JsonSyntaxException;
import works.lazon.value.JsonBigInteger;
import works.lazon.value.JsonUnsigned;
import works.lazon.value.JsonValue;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonEncoderTest {
	private final JsonEncoder encoder = new JsonEncoder(100);

	@Test
	void controlCharacters_useLowercaseHex() {
		assertEquals("\"\\u0001\\u0002\\u001f\"", encoder.encodeToString("\u0001\u0002\u001f"));
	}

	@Test
	void shortEscapes() {
		assertEquals("\"\\\"\\\\\\b\\f\\n\\r\\t/\"", encoder.encodeToString("\"\\\b\f\n\r\t/"));
	}

	@Test
	void nonAscii_passesThrough() {
		String text = "é中😎\u007f";
		assertArrayEquals(("\"" + text + "\"").getBytes(UTF_8), encoder.encode(text));
	}

	@Test
	void loneSurrogate_failsOnceAtTheEnd() {
		JsonSyntaxException e = assertThrows(JsonSyntaxException.class,
			() -> encoder.encode(List.of("fine", "bad \ud83d here", "\ude0e")));
		assertEquals(ErrorCode.UTF8_ERROR, e.code());
		assertEquals("invalid utf-8", e.getMessage());
	}

	@Test
	void maps() {
		Map<Object, Object> map = new LinkedHashMap<>();
		map.put("x", 1);
		map.put("y", "z");
		map.put(3, null);
		assertEquals("{\"x\":1,\"y\":\"z\",\"3\":null}", encoder.encodeToString(map));
		assertEquals("{}", encoder.encodeToString(Map.of()));
	}

	@Test
	void collections() {
		assertEquals("[true,null,\"text\"]", encoder.encodeToString(Arrays.asList(true, null, "text")));
		assertEquals("[]", encoder.encodeToString(new ArrayList<>()));
		assertEquals("[1,2,3]", encoder.encodeToString(new int[] { 1, 2, 3 }));
		assertEquals("[\"a\",[\"b\"]]", encoder.encodeToString(new Object[] { "a", new String[] { "b" } }));
	}

	@Test
	void numbers() {
		assertEquals("[-5,7,300,2,18446744073709551616,1.25,0.5,2.5,1.0E20]", encoder.encodeToString(List.of(
			-5L, (short) 7, 300, (byte) 2,
			BigInteger.ONE.shiftLeft(64),
			new BigDecimal("1.25"), 0.5f, 2.5, 1e20)));
	}

	@Test
	void atomicAndAccumulatingNumbers() {
		LongAdder adder = new LongAdder();
		adder.add(Long.MAX_VALUE);
		DoubleAdder doubleAdder = new DoubleAdder();
		doubleAdder.add(0.25);
		assertEquals("[5,9223372036854775807,9223372036854775807,0.25]",
			encoder.encodeToString(List.of(new AtomicInteger(5), new AtomicLong(Long.MAX_VALUE), adder, doubleAdder)));
	}

	@Test
	void unknownNumberType_isRejected() {
		Number custom = new Number() {
			@Override public int intValue() { return 1; }
			@Override public long longValue() { return 1; }
			@Override public float floatValue() { return 1; }
			@Override public double doubleValue() { return 1; }
		};
		assertThrows(IllegalArgumentException.class, () -> encoder.encode(List.of(custom)));
	}

	@Test
	void bigIntegerValues() {
		String digits = "-123456789012345678901234567890";
		String json = encoder.encodeToString(JsonValue.array(new JsonBigInteger(digits)));
		assertEquals("[" + digits + "]", json);
		assertEquals(JsonValue.array(new JsonBigInteger(digits)), Json.parse(json));
	}

	@ParameterizedTest
	@ValueSource(strings = { "", "-", "+1", "1.5", "1e5", " 1", "1,\"injected\":{" })
	void bigIntegerValues_mustBeDecimalIntegers(String digits) {
		JsonNumberException e = assertThrows(JsonNumberException.class, () -> new JsonBigInteger(digits));
		assertEquals(ErrorCode.BIGINT_ERROR, e.code());
	}

	@ParameterizedTest
	@ValueSource(doubles = { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY })
	void nonFinite_isNull(double d) {
		assertEquals("null", encoder.encodeToString(d));
		assertEquals("[null]", encoder.encodeToString(JsonValue.array(JsonValue.of(d))));
	}

	@Test
	void jsonValues() {
		assertEquals("18446744073709551615", encoder.encodeToString(new JsonUnsigned(-1L)));
		assertEquals("[null,false,9]", encoder.encodeToString(JsonValue.array(JsonValue.nullValue(), JsonValue.of(false), JsonValue.of(9))));
	}

	@Test
	void otherObjects() {
		assertEquals("\"WEDNESDAY\"", encoder.encodeToString(DayOfWeek.WEDNESDAY));
		assertEquals("\"custom\"", encoder.encodeToString(new Object() {
			@Override
			public String toString() {
				return "custom";
			}
		}));
		assertEquals("\"builder\"", encoder.encodeToString(new StringBuilder("builder")));
	}

	@Test
	void nestingLimit() {
		List<Object> deep = new ArrayList<>();
		List<Object> current = deep;
		for (int i = 0; i < 100; i++) {
			List<Object> next = new ArrayList<>();
			current.add(next);
			current = next;
		}
		JsonResourceException e = assertThrows(JsonResourceException.class, () -> encoder.encode(deep));
		assertEquals(ErrorCode.DEPTH_ERROR, e.code());
	}

	@Test
	void outputLimit() {
		JsonEncoder tiny = new JsonEncoder(10, 8);
		assertEquals("\"123456\"", tiny.encodeToString("123456"));
		JsonResourceException e = assertThrows(JsonResourceException.class, () -> tiny.encode("1234567"));
		assertEquals(ErrorCode.OUT_OF_CAPACITY, e.code());
	}
}
