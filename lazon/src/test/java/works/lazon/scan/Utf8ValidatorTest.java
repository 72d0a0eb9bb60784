package works.lazon.scan;

import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Utf8ValidatorTest {

	@Test
	void wellFormed() {
		assertValid("");
		assertValid("plain ascii text that is longer than eight bytes");
		assertValid("é中😎 mixed with ascii");
	}

	@Test
	void overlong() {
		assertInvalidAt(0, 0xC0, 0xAF);
		assertInvalidAt(0, 0xE0, 0x80, 0xAF);
		assertInvalidAt(0, 0xF0, 0x80, 0x80, 0xAF);
	}

	@Test
	void surrogates() {
		// U+D800 encoded directly
		assertInvalidAt(0, 0xED, 0xA0, 0x80);
	}

	@Test
	void beyondUnicode() {
		assertInvalidAt(0, 0xF4, 0x90, 0x80, 0x80);
		assertInvalidAt(0, 0xF5, 0x80, 0x80, 0x80);
	}

	@Test
	void truncated() {
		assertInvalidAt(3, 'a', 'b', 'c', 0xE4, 0xB8);
	}

	@Test
	void strayContinuation() {
		assertInvalidAt(9, 'a', 'b', 'c', 'd', 'e', 'f', 'g', 'h', 'i', 0x80);
	}

	private static void assertValid(String text) {
		byte[] bytes = text.getBytes(UTF_8);
		assertTrue(Utf8Validator.isValid(bytes, 0, bytes.length), text);
	}

	private static void assertInvalidAt(int expected, int... values) {
		byte[] bytes = new byte[values.length];
		for (int i = 0; i < values.length; i++) {
			bytes[i] = (byte) values[i];
		}
		assertFalse(Utf8Validator.isValid(bytes, 0, bytes.length));
		assertEquals(expected, Utf8Validator.firstInvalid(bytes, 0, bytes.length));
	}
}
