package works.lazon;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lazon.buffer.BufferManager;
import works.lazon.buffer.BufferView;
import works.lazon.buffer.HostBytes;
import works.lazon.buffer.PaddedBuffer;
import works.lazon.codec.JsonEncoder;
import works.lazon.document.LazyDocument;
import works.lazon.scan.JsonIterator;
import works.lazon.scan.ScanEngine;
import works.lazon.value.JsonValue;
import works.lazon.value.KeyConverter;
import works.lazon.value.ValueMaterializer;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Entry points for parsing and generating JSON.
 * <p>
 * The {@code parse} and {@code load} methods read an entire document into a {@link JsonValue}.
 * The {@code parseLazy} and {@code loadLazy} methods instead return a {@link LazyDocument}
 * that materializes only what is read from it.
 * <p>
 * Each thread has its own default {@link Parser} for lazy documents.
 * Every lazy document created with the default parser makes the previous one
 * from the same thread stale; pass an explicit {@link Parser} to avoid this.
 */
public final class Json {
	private Json() {}

	private static volatile JsonConfig config = JsonConfig.fromSystemProperties();

	private static final ThreadLocal<Parser> DEFAULT_PARSER = new ThreadLocal<>();
	private static final ThreadLocal<Parser> EAGER_PARSER = new ThreadLocal<>();

	public static JsonConfig config() {
		return config;
	}

	/**
	 * Replaces the process-wide configuration.
	 * Takes effect at the next call into this class; existing {@link Parser}s keep the configuration they were created with.
	 */
	public static void configure(JsonConfig newConfig) {
		config = requireNonNull(newConfig);
		LOGGER.debug("Configured {}", newConfig);
	}

	public static void setZeroCopyParsing(boolean zeroCopyParsing) {
		configure(config.withZeroCopyParsing(zeroCopyParsing));
	}

	/**
	 * @return the name of the scanning implementation in use
	 */
	public static String implementation() {
		return "scalar";
	}

	//
	// Eager parsing
	//

	public static JsonValue parse(String json) {
		return parse(json, false);
	}

	/**
	 * @param symbolizeKeys if true, object keys are {@link String#intern() interned}
	 */
	public static JsonValue parse(String json, boolean symbolizeKeys) {
		JsonConfig current = config;
		return parse(new BufferManager(current).view(json), current, symbolizeKeys);
	}

	public static JsonValue parse(byte[] json) {
		JsonConfig current = config;
		return parse(new BufferManager(current).view(json), current, false);
	}

	public static JsonValue parse(HostBytes json) {
		return parse(json, false);
	}

	/**
	 * May freeze {@code json}; see {@link BufferManager#view(HostBytes)}.
	 */
	public static JsonValue parse(HostBytes json, boolean symbolizeKeys) {
		JsonConfig current = config;
		return parse(new BufferManager(current).view(json), current, symbolizeKeys);
	}

	public static JsonValue load(Path path) {
		return load(path, false);
	}

	/**
	 * @throws works.lazon.exceptions.JsonProcessingException with {@link works.lazon.exceptions.ErrorCode#IO_ERROR IO_ERROR}
	 * if the file can't be read
	 */
	public static JsonValue load(Path path, boolean symbolizeKeys) {
		return parse(PaddedBuffer.load(path).view(), config, symbolizeKeys);
	}

	private static JsonValue parse(BufferView view, JsonConfig current, boolean symbolizeKeys) {
		ScanEngine engine = threadParser(EAGER_PARSER, current).engine();
		JsonIterator iterator = engine.iterate(view);
		ValueMaterializer materializer = new ValueMaterializer(KeyConverter.forSymbolizedKeys(symbolizeKeys));
		try (var lease = engine.acquire()) {
			return materializer.materializeDocument(iterator);
		}
	}

	//
	// Lazy parsing
	//

	public static LazyDocument parseLazy(String json) {
		return parseLazy(json, defaultParser());
	}

	public static LazyDocument parseLazy(String json, Parser parser) {
		return parser.iterate(json);
	}

	public static LazyDocument parseLazy(HostBytes json) {
		return parseLazy(json, defaultParser());
	}

	public static LazyDocument parseLazy(HostBytes json, Parser parser) {
		return parser.iterate(json);
	}

	public static LazyDocument loadLazy(Path path) {
		return loadLazy(path, defaultParser());
	}

	public static LazyDocument loadLazy(Path path, Parser parser) {
		return parser.iterate(PaddedBuffer.load(path).view());
	}

	/**
	 * The calling thread's default parser, created on first use
	 * and replaced whenever {@link #configure} has been called since.
	 */
	public static Parser defaultParser() {
		return threadParser(DEFAULT_PARSER, config);
	}

	private static Parser threadParser(ThreadLocal<Parser> parsers, JsonConfig current) {
		Parser parser = parsers.get();
		if (parser == null || parser.config() != current) {
			LOGGER.debug("Creating parser for thread {}", Thread.currentThread().getName());
			parser = new Parser(current);
			parsers.set(parser);
		}
		return parser;
	}

	//
	// Generating
	//

	/**
	 * @param value a {@link JsonValue} or a plain Java object, as described in {@link JsonEncoder}
	 * @throws works.lazon.exceptions.JsonSyntaxException with {@link works.lazon.exceptions.ErrorCode#UTF8_ERROR UTF8_ERROR}
	 * if a string in {@code value} isn't valid Unicode
	 */
	public static String dump(Object value) {
		return new String(dumpBytes(value), UTF_8);
	}

	public static byte[] dumpBytes(Object value) {
		return new JsonEncoder(config.defaultMaxDepth()).encode(value);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Json.class);
}
