package works.lazon;

import works.lazon.buffer.PaddedBuffer;

import static java.lang.Integer.bitCount;

/**
 * Settings that govern buffer selection and parser limits.
 * <p>
 * Immutable. Components receive one of these at construction time
 * rather than consulting {@link Json#config()} themselves.
 */
public final class JsonConfig {
	public static final int DEFAULT_PAGE_SIZE = 4096;
	public static final int DEFAULT_CAPACITY = 1 << 20;
	public static final int DEFAULT_MAX_DEPTH = 1024;
	public static final int DEFAULT_MAX_BIG_INTEGER_DIGITS = 1000;

	/**
	 * The largest document a padded buffer can hold.
	 */
	public static final int MAX_CAPACITY = Integer.MAX_VALUE - PaddedBuffer.PADDING;

	private final boolean zeroCopyParsing;
	private final boolean debugBuffers;
	private final int pageSize;
	private final int defaultCapacity;
	private final int maxCapacity;
	private final int defaultMaxDepth;
	private final int maxBigIntegerDigits;

	private JsonConfig(
		boolean zeroCopyParsing,
		boolean debugBuffers,
		int pageSize,
		int defaultCapacity,
		int maxCapacity,
		int defaultMaxDepth,
		int maxBigIntegerDigits
	) {
		this.zeroCopyParsing = zeroCopyParsing;
		this.debugBuffers = debugBuffers;
		this.pageSize = pageSize;
		this.defaultCapacity = defaultCapacity;
		this.maxCapacity = maxCapacity;
		this.defaultMaxDepth = defaultMaxDepth;
		this.maxBigIntegerDigits = maxBigIntegerDigits;
	}

	public static JsonConfig defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Starts from {@link #defaults()} and applies any of these system properties that are set:
	 * {@code lazon.zeroCopyParsing}, {@code lazon.debugBuffers},
	 * {@code lazon.pageSize}, {@code lazon.maxDepth}.
	 */
	public static JsonConfig fromSystemProperties() {
		Builder builder = builder();
		String zeroCopy = System.getProperty("lazon.zeroCopyParsing");
		if (zeroCopy != null) {
			builder.zeroCopyParsing(Boolean.parseBoolean(zeroCopy));
		}
		String debug = System.getProperty("lazon.debugBuffers");
		if (debug != null) {
			builder.debugBuffers(Boolean.parseBoolean(debug));
		}
		Integer pageSize = Integer.getInteger("lazon.pageSize");
		if (pageSize != null) {
			builder.pageSize(pageSize);
		}
		Integer maxDepth = Integer.getInteger("lazon.maxDepth");
		if (maxDepth != null) {
			builder.defaultMaxDepth(maxDepth);
		}
		return builder.build();
	}

	public Builder toBuilder() {
		return new Builder()
			.zeroCopyParsing(zeroCopyParsing)
			.debugBuffers(debugBuffers)
			.pageSize(pageSize)
			.defaultCapacity(defaultCapacity)
			.maxCapacity(maxCapacity)
			.defaultMaxDepth(defaultMaxDepth)
			.maxBigIntegerDigits(maxBigIntegerDigits);
	}

	public JsonConfig withZeroCopyParsing(boolean zeroCopyParsing) {
		return toBuilder().zeroCopyParsing(zeroCopyParsing).build();
	}

	/**
	 * When true, host byte strings may be scanned in place instead of being copied.
	 */
	public boolean zeroCopyParsing() {
		return zeroCopyParsing;
	}

	/**
	 * When true, every input is copied into a private padded buffer,
	 * regardless of {@link #zeroCopyParsing()}.
	 * Useful for flushing out code that reads past the logical end of its input.
	 */
	public boolean debugBuffers() {
		return debugBuffers;
	}

	public int pageSize() {
		return pageSize;
	}

	public int defaultCapacity() {
		return defaultCapacity;
	}

	public int maxCapacity() {
		return maxCapacity;
	}

	public int defaultMaxDepth() {
		return defaultMaxDepth;
	}

	/**
	 * Integers with more digits than this are rejected rather than
	 * converted to {@link java.math.BigInteger}.
	 */
	public int maxBigIntegerDigits() {
		return maxBigIntegerDigits;
	}

	@Override
	public String toString() {
		return "JsonConfig(zeroCopyParsing=" + zeroCopyParsing
			+ ", debugBuffers=" + debugBuffers
			+ ", pageSize=" + pageSize
			+ ", defaultCapacity=" + defaultCapacity
			+ ", maxCapacity=" + maxCapacity
			+ ", defaultMaxDepth=" + defaultMaxDepth
			+ ", maxBigIntegerDigits=" + maxBigIntegerDigits
			+ ")";
	}

	public static class Builder {
		private boolean zeroCopyParsing = false;
		private boolean debugBuffers = false;
		private int pageSize = DEFAULT_PAGE_SIZE;
		private int defaultCapacity = DEFAULT_CAPACITY;
		private int maxCapacity = MAX_CAPACITY;
		private int defaultMaxDepth = DEFAULT_MAX_DEPTH;
		private int maxBigIntegerDigits = DEFAULT_MAX_BIG_INTEGER_DIGITS;

		Builder() {}

		public Builder zeroCopyParsing(boolean zeroCopyParsing) {
			this.zeroCopyParsing = zeroCopyParsing;
			return this;
		}

		public Builder debugBuffers(boolean debugBuffers) {
			this.debugBuffers = debugBuffers;
			return this;
		}

		public Builder pageSize(int pageSize) {
			if (pageSize <= PaddedBuffer.PADDING || bitCount(pageSize) != 1) {
				throw new IllegalArgumentException("Page size must be a power of two larger than the padding: " + pageSize);
			}
			this.pageSize = pageSize;
			return this;
		}

		public Builder defaultCapacity(int defaultCapacity) {
			if (defaultCapacity < 0) {
				throw new IllegalArgumentException("Capacity can't be negative: " + defaultCapacity);
			}
			this.defaultCapacity = defaultCapacity;
			return this;
		}

		public Builder maxCapacity(int maxCapacity) {
			if (maxCapacity < 0 || maxCapacity > MAX_CAPACITY) {
				throw new IllegalArgumentException("Max capacity must be between 0 and " + MAX_CAPACITY + ": " + maxCapacity);
			}
			this.maxCapacity = maxCapacity;
			return this;
		}

		public Builder defaultMaxDepth(int defaultMaxDepth) {
			if (defaultMaxDepth <= 0) {
				throw new IllegalArgumentException("Max depth must be positive: " + defaultMaxDepth);
			}
			this.defaultMaxDepth = defaultMaxDepth;
			return this;
		}

		public Builder maxBigIntegerDigits(int maxBigIntegerDigits) {
			if (maxBigIntegerDigits < 20) {
				throw new IllegalArgumentException("Must allow at least as many digits as an unsigned 64-bit integer: " + maxBigIntegerDigits);
			}
			this.maxBigIntegerDigits = maxBigIntegerDigits;
			return this;
		}

		public JsonConfig build() {
			if (defaultCapacity > maxCapacity) {
				throw new IllegalArgumentException("Default capacity " + defaultCapacity + " exceeds max capacity " + maxCapacity);
			}
			return new JsonConfig(zeroCopyParsing, debugBuffers, pageSize, defaultCapacity, maxCapacity, defaultMaxDepth, maxBigIntegerDigits);
		}

		@Override
		public String toString() {
			return "JsonConfig.Builder(zeroCopyParsing=" + zeroCopyParsing + ", debugBuffers=" + debugBuffers + ", pageSize=" + pageSize + ")";
		}
	}

	private static final JsonConfig DEFAULTS = new Builder().build();
}
