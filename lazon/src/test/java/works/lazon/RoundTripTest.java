package works.lazon;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.LongStream;
import org.junit.jupiter.params.Parameter;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import works.lazon.document.LazyDocument;
import works.lazon.value.JsonValue;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Checks agreement with Jackson on randomly generated documents.
 */
@ParameterizedClass
@MethodSource("seeds")
class RoundTripTest {
	@Parameter
	long seed;

	private final ObjectMapper jackson = new ObjectMapper();

	static LongStream seeds() {
		return LongStream.range(0, 20).map(i -> 1_000_003L * i + 123);
	}

	@ParameterizedTest
	@ValueSource(ints = { 0, 1, 4 })
	void parse_matchesJacksonOutput(int maxDepth) {
		Object expected = TestUtils.randomValue(new Random(seed), maxDepth);
		String text = jackson.writeValueAsString(expected);
		assertEquals(expected, Json.parse(text).toJava(), text);
	}

	@ParameterizedTest
	@ValueSource(ints = { 0, 1, 4 })
	void dump_isReadableByJackson(int maxDepth) {
		Object original = TestUtils.randomValue(new Random(seed), maxDepth);
		String text = jackson.writeValueAsString(original);

		String dumped = Json.dump(Json.parse(text));

		JsonNode expected = jackson.readTree(text);
		assertEquals(expected, jackson.readTree(dumped), dumped);
		assertEquals(text, jackson.writeValueAsString(jackson.readTree(dumped)));
	}

	@ParameterizedTest
	@ValueSource(booleans = { false, true })
	void lazy_agreesWithEager(boolean zeroCopy) {
		Object original = TestUtils.randomValue(new Random(seed), 4);
		String text = jackson.writeValueAsString(Map.of("payload", Collections.singletonList(original)));
		JsonValue eager = Json.parse(text);

		Parser parser = new Parser(Json.config().withZeroCopyParsing(zeroCopy));
		LazyDocument doc = parser.iterate(text);
		assertEquals(eager, doc.value());
		assertEquals(eager, doc.rewind().value());
		assertEquals(original, doc.atPointer("/payload/0").orElseThrow().toJava());
		assertEquals(original, doc.atPath("payload[0]").orElseThrow().toJava());
	}

	@ParameterizedTest
	@ValueSource(ints = { 2, 4 })
	void objectEach_seesEveryMember(int maxDepth) {
		Random r = new Random(seed);
		Map<String, Object> expected = new LinkedHashMap<>();
		for (int i = 0; i < 5; i++) {
			expected.put("m" + i + TestUtils.randomString(r), TestUtils.randomValue(r, maxDepth));
		}
		LazyDocument doc = new Parser().iterate(jackson.writeValueAsString(expected));

		Map<String, Object> actual = new LinkedHashMap<>();
		doc.objectEach((key, value) -> actual.put(key, value.toJava()));
		assertEquals(expected, actual);
		assertEquals(List.copyOf(expected.keySet()), List.copyOf(actual.keySet()));
	}
}
