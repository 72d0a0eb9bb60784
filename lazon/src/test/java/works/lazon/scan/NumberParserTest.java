package works.lazon.scan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.JsonNumberException;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.lazon.scan.NumberType.BIG_INTEGER;
import static works.lazon.scan.NumberType.FLOATING_POINT;
import static works.lazon.scan.NumberType.SIGNED_INTEGER;
import static works.lazon.scan.NumberType.UNSIGNED_INTEGER;

class NumberParserTest {

	@Test
	void smallIntegers() {
		assertEquals(ScannedNumber.signed(0), parse("0"));
		assertEquals(ScannedNumber.signed(-7), parse("-7"));
		assertEquals(ScannedNumber.signed(123456789012345678L), parse("123456789012345678"));
	}

	@Test
	void signedLimits() {
		assertEquals(ScannedNumber.signed(Long.MAX_VALUE), parse("9223372036854775807"));
		assertEquals(ScannedNumber.signed(Long.MIN_VALUE), parse("-9223372036854775808"));
	}

	@Test
	void unsignedRange() {
		ScannedNumber twoToThe63 = parse("9223372036854775808");
		assertEquals(UNSIGNED_INTEGER, twoToThe63.type());
		assertEquals("9223372036854775808", Long.toUnsignedString(twoToThe63.bits()));

		ScannedNumber max = parse("18446744073709551615");
		assertEquals(UNSIGNED_INTEGER, max.type());
		assertEquals(-1L, max.bits());
	}

	@Test
	void beyond64Bits() {
		ScannedNumber big = parse("18446744073709551616");
		assertEquals(BIG_INTEGER, big.type());
		assertEquals("18446744073709551616", big.text());
		assertEquals(BIG_INTEGER, parse("-9223372036854775809").type());
	}

	@Test
	void tooManyDigits() {
		String digits = "9".repeat(101);
		JsonNumberException e = assertThrows(JsonNumberException.class, () -> parse(digits, 100));
		assertEquals(ErrorCode.BIGINT_ERROR, e.code());
	}

	@ParameterizedTest
	@ValueSource(strings = { "1.5", "-0.0", "1e10", "1E+2", "2.5e-3", "0.1" })
	void floatingPoint(String text) {
		ScannedNumber number = parse(text);
		assertEquals(FLOATING_POINT, number.type());
		assertEquals(Double.parseDouble(text), number.doubleValue());
	}

	@Test
	void integerTypeIsNotSecondGuessed() {
		assertEquals(SIGNED_INTEGER, parse("10").type());
		assertEquals(FLOATING_POINT, parse("10.0").type());
	}

	@Test
	void hugeExponent_isOutOfRange() {
		JsonNumberException e = assertThrows(JsonNumberException.class, () -> parse("1e400"));
		assertEquals(ErrorCode.NUMBER_OUT_OF_RANGE, e.code());
	}

	@ParameterizedTest
	@ValueSource(strings = { "-", "01", "1.", ".5", "1e", "1e+", "12.3.4", "1-2", "--1", "1x", "+1" })
	void malformed(String text) {
		JsonNumberException e = assertThrows(JsonNumberException.class, () -> parse(text));
		assertEquals(ErrorCode.NUMBER_ERROR, e.code());
	}

	@Test
	void stopsAtTerminator() {
		byte[] bytes = "[12,3]".getBytes(US_ASCII);
		assertEquals(ScannedNumber.signed(12), NumberParser.parse(bytes, 0, 1, bytes.length, 100));
	}

	private static ScannedNumber parse(String text) {
		return parse(text, 1000);
	}

	private static ScannedNumber parse(String text, int maxDigits) {
		byte[] bytes = text.getBytes(US_ASCII);
		return NumberParser.parse(bytes, 0, 0, bytes.length, maxDigits);
	}
}
