package works.lazon;

import java.io.IOException;
import java.io.InputStream;
import java.lang.module.ModuleDescriptor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.lazon.buffer.HostBytes;
import works.lazon.document.LazyDocument;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.JsonEmptyInputException;
import works.lazon.exceptions.JsonException;
import works.lazon.exceptions.JsonNumberException;
import works.lazon.exceptions.JsonProcessingException;
import works.lazon.exceptions.JsonResourceException;
import works.lazon.exceptions.JsonSyntaxException;
import works.lazon.value.JsonObject;
import works.lazon.value.JsonUnsigned;
import works.lazon.value.JsonValue;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.stream.Collectors.toSet;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.lazon.TestUtils.ONE_OF_EACH;

class JsonTest {
	private final JsonConfig originalConfig = Json.config();

	@AfterEach
	void restoreConfig() {
		Json.configure(originalConfig);
	}

	@Test
	void parse_oneOfEach() {
		JsonObject object = assertInstanceOf(JsonObject.class, Json.parse(ONE_OF_EACH));
		Map<?, ?> members = (Map<?, ?>) object.toJava();
		assertEquals(true, members.get("trueField"));
		assertEquals(123L, members.get("integerField"));
		assertEquals(3.14, members.get("realField"));
		assertEquals("hello 😎", members.get("stringField"));
		assertEquals(List.of("one", "two", "three"), members.get("stringArrayField"));
		assertTrue(members.containsKey("nullField"));
	}

	@Test
	void parse_bytesAndHostBytes() {
		JsonValue expected = Json.parse("[1,\"two\"]");
		assertEquals(expected, Json.parse("[1,\"two\"]".getBytes(UTF_8)));
		assertEquals(expected, Json.parse(HostBytes.of("[1,\"two\"]")));
	}

	@Test
	void parse_symbolizedKeys() {
		JsonObject object = (JsonObject) Json.parse("{\"interned\": 1}", true);
		assertSame("interned", object.members().keySet().iterator().next());
	}

	@Test
	void twoToThe63_roundTrips() {
		JsonValue value = Json.parse("9223372036854775808");
		assertInstanceOf(JsonUnsigned.class, value);
		assertEquals("9223372036854775808", Json.dump(value));
	}

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
		"{\"a\":}              | TAPE_ERROR",
		"{\"a\":1,}            | TAPE_ERROR",
		"{key:\"value\"}       | TAPE_ERROR",
		"[1 2]                 | TAPE_ERROR",
		"\"Line\\qBreak\"      | STRING_ERROR",
		"\"unterminated        | UNCLOSED_STRING",
		"{\"a\":1}trailing     | TRAILING_CONTENT",
		"true garbage          | TRAILING_CONTENT",
		"[1, 2                 | INCOMPLETE_ARRAY_OR_OBJECT",
		"tru                   | T_ATOM_ERROR",
		"fals                  | F_ATOM_ERROR",
		"nul                   | N_ATOM_ERROR",
	})
	void syntaxErrors(String json, ErrorCode expected) {
		JsonSyntaxException e = assertThrows(JsonSyntaxException.class, () -> Json.parse(json));
		assertEquals(expected, e.code());
		assertEquals(expected.kind(), e.kind());
	}

	@Test
	void controlCharacterInString() {
		JsonSyntaxException e = assertThrows(JsonSyntaxException.class, () -> Json.parse("\"a\u0007b\""));
		assertEquals(ErrorCode.UNESCAPED_CHARS, e.code());
	}

	@Test
	void invalidUtf8() {
		byte[] bytes = { '"', (byte) 0xC0, (byte) 0xAF, '"' };
		JsonSyntaxException e = assertThrows(JsonSyntaxException.class, () -> Json.parse(bytes));
		assertEquals(ErrorCode.UTF8_ERROR, e.code());
	}

	@ParameterizedTest
	@ValueSource(strings = { "", " ", "\n\t\r " })
	void emptyInput(String json) {
		JsonEmptyInputException e = assertThrows(JsonEmptyInputException.class, () -> Json.parse(json));
		assertEquals(ErrorCode.EMPTY_INPUT, e.code());
	}

	@Test
	void tooDeep() {
		String json = "[".repeat(2048) + "]".repeat(2048);
		JsonResourceException e = assertThrows(JsonResourceException.class, () -> Json.parse(json));
		assertEquals(ErrorCode.DEPTH_ERROR, e.code());
	}

	@Test
	void numberErrors() {
		JsonNumberException e = assertThrows(JsonNumberException.class, () -> Json.parse("{\"x\":12.3.4}"));
		assertEquals(ErrorCode.NUMBER_ERROR, e.code());
		JsonNumberException big = assertThrows(JsonNumberException.class, () -> Json.parse("9".repeat(20000)));
		assertEquals(ErrorCode.BIGINT_ERROR, big.code());
	}

	@Test
	void errorsAreCatchableAsOneType() {
		JsonException e = assertThrows(JsonException.class, () -> Json.parse("{"));
		assertEquals(ErrorCode.INCOMPLETE_ARRAY_OR_OBJECT, e.code());
	}

	@Test
	void dump() {
		assertEquals("{\"x\":1,\"y\":\"z\"}", Json.dump(Json.parse("{ \"x\" : 1 , \"y\" : \"z\" }")));
		assertEquals("[true,null,\"text\"]", Json.dump(Arrays.asList(true, null, "text")));
		assertEquals("\"\\u0001\\u0002\\u001f\"", Json.dump("\u0001\u0002\u001f"));
	}

	@Test
	void load(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("doc.json");
		Files.writeString(file, "{\"a\": [1, 2, 3]}", UTF_8);
		assertEquals(Json.parse("{\"a\":[1,2,3]}"), Json.load(file));

		LazyDocument doc = Json.loadLazy(file, new Parser());
		assertEquals(List.of(JsonValue.of(2)), doc.atPathWithWildcard("a[1]"));
	}

	@Test
	void load_missingFile(@TempDir Path dir) {
		JsonProcessingException e = assertThrows(JsonProcessingException.class, () -> Json.load(dir.resolve("absent.json")));
		assertEquals(ErrorCode.IO_ERROR, e.code());
		assertInstanceOf(IOException.class, e.getCause());
	}

	@Test
	void parseLazy_defaultParserIsShared() {
		LazyDocument first = Json.parseLazy("{\"n\": 1}");
		LazyDocument second = Json.parseLazy("{\"n\": 2}");
		assertFalse(first.isAlive(), "Same default parser");
		assertEquals(Optional.of(JsonValue.of(1)), first.get("n"));
		assertEquals(Optional.of(JsonValue.of(2)), second.get("n"));
	}

	@Test
	void parseLazy_explicitParsers() {
		LazyDocument first = Json.parseLazy("{\"n\": 1}", new Parser());
		LazyDocument second = Json.parseLazy(HostBytes.of("{\"n\": 2}"), new Parser());
		assertTrue(first.isAlive());
		assertTrue(second.isAlive());
	}

	@Test
	void setZeroCopyParsing_affectsLaterCalls() {
		Json.setZeroCopyParsing(true);
		assertTrue(Json.config().zeroCopyParsing());
		HostBytes roomy = HostBytes.allocateAt(0, 100).append("[1]");
		LazyDocument doc = Json.parseLazy(roomy);
		assertTrue(doc.view().isBorrowed());
		assertTrue(roomy.isFrozen());

		Json.setZeroCopyParsing(false);
		assertFalse(Json.config().zeroCopyParsing());
		HostBytes frozen = HostBytes.of("[2]").freeze();
		assertNotSame(frozen, Json.parseLazy(frozen).view().owner());
	}

	@Test
	void implementation() {
		assertEquals("scalar", Json.implementation());
	}

	@Test
	void moduleDescriptor_exportsEveryPackage() throws IOException {
		ModuleDescriptor descriptor;
		try (InputStream in = Json.class.getResourceAsStream("/module-info.class")) {
			assertNotNull(in, "module-info.class");
			descriptor = ModuleDescriptor.read(in);
		}
		assertEquals("works.lazon", descriptor.name());
		assertEquals(
			Set.of("works.lazon", "works.lazon.buffer", "works.lazon.codec", "works.lazon.document",
				"works.lazon.exceptions", "works.lazon.scan", "works.lazon.value"),
			descriptor.exports().stream().map(ModuleDescriptor.Exports::source).collect(toSet()));
		assertTrue(descriptor.requires().stream().anyMatch(r -> r.name().equals("org.slf4j")));
	}
}
