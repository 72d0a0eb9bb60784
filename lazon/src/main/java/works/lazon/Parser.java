package works.lazon;

import works.lazon.buffer.BufferManager;
import works.lazon.buffer.BufferView;
import works.lazon.buffer.HostBytes;
import works.lazon.document.LazyDocument;
import works.lazon.scan.ScanEngine;

import static java.util.Objects.requireNonNull;

/**
 * Scans documents one at a time for lazy access.
 * <p>
 * A parser may be reused for any number of documents, but each new
 * {@link #iterate} makes the previous documents stale;
 * they rescan themselves the next time they're read.
 * Use separate parsers for documents that must be read concurrently.
 */
public final class Parser {
	private final JsonConfig config;
	private final BufferManager bufferManager;
	private final ScanEngine engine;

	/**
	 * Uses the current {@link Json#config() process-wide configuration}.
	 */
	public Parser() {
		this(Json.config());
	}

	/**
	 * Uses the current process-wide configuration, with the default capacity lowered to {@code maxCapacity} if necessary.
	 */
	public Parser(int maxCapacity) {
		this(Json.config().toBuilder()
			.defaultCapacity(Math.min(maxCapacity, Json.config().defaultCapacity()))
			.maxCapacity(maxCapacity)
			.build());
	}

	public Parser(JsonConfig config) {
		this.config = requireNonNull(config);
		this.bufferManager = new BufferManager(config);
		this.engine = new ScanEngine(config.maxCapacity(), config.defaultMaxDepth(), config.maxBigIntegerDigits());
	}

	public JsonConfig config() {
		return config;
	}

	public ScanEngine engine() {
		return engine;
	}

	public int capacity() {
		return engine.capacity();
	}

	public int maxCapacity() {
		return engine.maxCapacity();
	}

	public Parser allocate() {
		return allocate(config.defaultCapacity());
	}

	public Parser allocate(int capacity) {
		return allocate(capacity, config.defaultMaxDepth());
	}

	/**
	 * @throws works.lazon.exceptions.JsonResourceException with {@link works.lazon.exceptions.ErrorCode#CAPACITY CAPACITY}
	 * if {@code capacity} exceeds {@link #maxCapacity()}
	 * @throws IllegalArgumentException if {@code maxDepth} isn't positive
	 */
	public Parser allocate(int capacity, int maxDepth) {
		engine.allocate(capacity, maxDepth);
		return this;
	}

	public LazyDocument iterate(HostBytes json) {
		return iterate(bufferManager.view(json));
	}

	public LazyDocument iterate(String json) {
		return iterate(bufferManager.view(json));
	}

	public LazyDocument iterate(byte[] json) {
		return iterate(bufferManager.view(json));
	}

	public LazyDocument iterate(BufferView view) {
		return LazyDocument.iterate(view, engine);
	}

	@Override
	public String toString() {
		return "Parser(" + engine + ")";
	}
}
