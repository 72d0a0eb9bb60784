package works.lazon;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import tools.jackson.databind.ObjectMapper;
import works.lazon.buffer.HostBytes;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.openjdk.jmh.annotations.Mode.Throughput;
import static works.lazon.TestUtils.ONE_OF_EACH;

@BenchmarkMode(Throughput)
@State(Scope.Thread)
@Fork(3)
@Warmup(iterations = 8, time = 1)
@Measurement(iterations = 5, time = 1, timeUnit = SECONDS)
public class ParseBenchmark {
	private byte[] json;
	private byte[] bigJson;
	private ObjectMapper objectMapper;
	private Parser parser;
	private HostBytes borrowable;

	@Setup(Level.Iteration) // Called once per iteration
	public void setup() throws Exception {
		json = ONE_OF_EACH.getBytes(UTF_8);
		objectMapper = new ObjectMapper();
		parser = new Parser(Json.config().withZeroCopyParsing(true)).allocate();

		Path file = Path.of(BIG_FILE).toAbsolutePath();
		if (Files.exists(file)) {
			bigJson = Files.readAllBytes(file);
		} else {
			var r = new Random(123);
			bigJson = objectMapper.writeValueAsBytes(TestUtils.randomValue(r, 6));
		}

		borrowable = HostBytes.allocate(json.length + 64).append(json).freeze();
	}

	@Benchmark
	public Object jackson() {
		return objectMapper.readTree(json);
	}

	@Benchmark
	public Object eager() {
		return Json.parse(json);
	}

	@Benchmark
	public Object lazy_oneField() {
		return parser.iterate(json).get("stringField");
	}

	@Benchmark
	public Object lazy_pointer() {
		return parser.iterate(json).atPointer("/mapField/MILLISECONDS");
	}

	@Benchmark
	public Object lazy_zeroCopy() {
		return parser.iterate(borrowable).get("integerField");
	}

	@Benchmark
	public Object jackson_big() {
		return objectMapper.readTree(bigJson);
	}

	@Benchmark
	public Object eager_big() {
		return Json.parse(bigJson);
	}

	/**
	 * Generate this with {@link TestUtils#main}.
	 */
	static final String BIG_FILE = "lazon/target/bigfiles/100k.json";
}
