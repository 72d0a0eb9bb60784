package works.lazon.buffer;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.JsonProcessingException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.lazon.buffer.HostBytes.MAPPING_GRANULARITY;
import static works.lazon.buffer.PaddedBuffer.PADDING;

class HostBytesTest {

	@Test
	void storageExtendsToEndOfPage() {
		HostBytes bytes = HostBytes.allocateAt(100, 10);
		assertEquals(MAPPING_GRANULARITY - 100, bytes.storage().length);
		assertEquals(10, bytes.capacity());
		assertEquals(0, bytes.length());
	}

	@Test
	void appendBeyondCapacity_moves() {
		HostBytes bytes = HostBytes.allocateAt(MAPPING_GRANULARITY - 4, 4).append("abcd");
		long before = bytes.address();
		bytes.append("efgh");
		assertEquals("abcdefgh", bytes.toString());
		assertTrue(bytes.capacity() >= 8);
		assertTrue(bytes.address() != before);
	}

	@Test
	void frozen_rejectsMutation() {
		HostBytes bytes = HostBytes.of("abc").freeze();
		assertThrows(IllegalStateException.class, () -> bytes.append("d"));
		assertThrows(IllegalStateException.class, () -> bytes.setByte(0, (byte) 'x'));
		assertThrows(IllegalStateException.class, bytes::clear);
		assertEquals("abc", bytes.toString());
	}

	@Test
	void dup_isUnfrozen() {
		HostBytes original = HostBytes.of("abc").freeze();
		HostBytes copy = original.dup();
		assertFalse(copy.isFrozen());
		copy.setByte(0, (byte) 'x');
		assertEquals("xbc", copy.toString());
		assertEquals("abc", original.toString());
	}

	@Test
	void resize_zeroFills() {
		HostBytes bytes = HostBytes.of("ab");
		bytes.resize(5);
		assertEquals(5, bytes.length());
		assertEquals(0, bytes.byteAt(4));
		bytes.freeze();
		bytes.restoreLength(2);
		assertEquals("ab", bytes.toString());
	}

	@Test
	void paddedBuffer_load(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("doc.json");
		Files.writeString(file, "{\"a\":[1,2]}", UTF_8);
		PaddedBuffer buffer = PaddedBuffer.load(file);
		assertEquals(11, buffer.length());
		assertTrue(buffer.capacity() >= 11 + PADDING);
		assertTrue(buffer.view().isPadded());
	}

	@Test
	void paddedBuffer_loadMissingFile(@TempDir Path dir) {
		JsonProcessingException e = assertThrows(JsonProcessingException.class,
			() -> PaddedBuffer.load(dir.resolve("nope.json")));
		assertEquals(ErrorCode.IO_ERROR, e.code());
	}
}
