package works.lazon.scan;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lazon.buffer.BufferView;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorTaxonomy;

import static works.lazon.buffer.PaddedBuffer.PADDING;

/**
 * Owns the scratch memory for scanning one document at a time.
 * <p>
 * Each call to {@link #iterate} overwrites that memory, so it invalidates every
 * {@link JsonIterator} previously returned. Iterators detect this by comparing
 * their {@link JsonIterator#generation() generation} against this engine's.
 * <p>
 * Not thread safe. The {@link Lease} only detects overlapping use; it doesn't arbitrate it.
 */
public final class ScanEngine {
	private final int maxCapacity;
	private final int maxBigIntegerDigits;
	private final IntFunction<int[]> indexAllocator;
	private int capacity;
	private int maxDepth;

	/**
	 * Null until allocated, and again after a failed allocation.
	 */
	private int[] structurals;
	private boolean allocationFailed = false;

	private long generation = 0;
	private final AtomicBoolean busy = new AtomicBoolean(false);

	public ScanEngine(int maxCapacity, int maxDepth, int maxBigIntegerDigits) {
		this(maxCapacity, maxDepth, maxBigIntegerDigits, int[]::new);
	}

	/**
	 * @param indexAllocator creates the structural index arrays
	 */
	ScanEngine(int maxCapacity, int maxDepth, int maxBigIntegerDigits, IntFunction<int[]> indexAllocator) {
		if (maxCapacity < 0 || maxCapacity > Integer.MAX_VALUE - PADDING) {
			throw new IllegalArgumentException("Invalid max capacity: " + maxCapacity);
		}
		if (maxDepth <= 0) {
			throw new IllegalArgumentException("Max depth must be positive: " + maxDepth);
		}
		this.maxCapacity = maxCapacity;
		this.maxDepth = maxDepth;
		this.maxBigIntegerDigits = maxBigIntegerDigits;
		this.indexAllocator = indexAllocator;
	}

	public int capacity() {
		return capacity;
	}

	public int maxCapacity() {
		return maxCapacity;
	}

	public int maxDepth() {
		return maxDepth;
	}

	public long generation() {
		return generation;
	}

	public boolean isBusy() {
		return busy.get();
	}

	/**
	 * Reserves scratch memory for documents up to {@code capacity} bytes.
	 * Invalidates outstanding iterators.
	 */
	public void allocate(int capacity, int maxDepth) {
		if (capacity < 0 || capacity > maxCapacity) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.CAPACITY, "(requested " + capacity + ", max " + maxCapacity + ")");
		}
		if (maxDepth <= 0) {
			throw new IllegalArgumentException("Max depth must be positive: " + maxDepth);
		}
		try (var lease = acquire()) {
			generation++;
			this.maxDepth = maxDepth;
			if (structurals != null && this.capacity == capacity) {
				return;
			}
			LOGGER.debug("Allocating capacity {} (was {}), max depth {}", capacity, this.capacity, maxDepth);
			structurals = null;
			this.capacity = 0;
			try {
				structurals = indexAllocator.apply(capacity + 1);
			} catch (OutOfMemoryError e) {
				allocationFailed = true;
				throw ErrorTaxonomy.outOfMemory(e);
			}
			allocationFailed = false;
			this.capacity = capacity;
		}
	}

	/**
	 * Runs the first pass over {@code view} and returns an iterator positioned at its root.
	 * Grows the scratch memory if needed, up to {@link #maxCapacity()}.
	 */
	public JsonIterator iterate(BufferView view) {
		try (var lease = acquire()) {
			if (allocationFailed) {
				throw ErrorTaxonomy.exceptionFor(ErrorCode.UNINITIALIZED, "(a previous allocation failed)");
			}
			if (!view.isPadded()) {
				throw ErrorTaxonomy.exceptionFor(ErrorCode.INSUFFICIENT_PADDING,
					"(capacity " + view.capacity() + " for length " + view.length() + ")");
			}
			int length = view.length();
			if (length > capacity || structurals == null) {
				if (length > maxCapacity) {
					throw ErrorTaxonomy.exceptionFor(ErrorCode.CAPACITY, "(document is " + length + " bytes, max " + maxCapacity + ")");
				}
				grow(length);
			}

			// From here on, the scratch memory is being overwritten
			long currentGeneration = ++generation;
			int count = StructuralIndexer.index(view, structurals, maxDepth);
			if (count == 0) {
				throw ErrorTaxonomy.exceptionFor(ErrorCode.EMPTY_INPUT);
			}
			return new JsonIterator(this, view, structurals, count, currentGeneration, maxBigIntegerDigits);
		}
	}

	/**
	 * Marks this engine as in use until the returned lease is closed.
	 *
	 * @throws works.lazon.exceptions.JsonUsageException with {@link ErrorCode#PARSER_IN_USE} if it's already in use
	 */
	public Lease acquire() {
		if (!busy.compareAndSet(false, true)) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.PARSER_IN_USE);
		}
		return new Lease();
	}

	private void grow(int length) {
		int newCapacity = (int) Math.min(maxCapacity, Math.max(length, 2L * capacity));
		LOGGER.debug("Growing capacity from {} to {} for a {}-byte document", capacity, newCapacity, length);
		structurals = null;
		capacity = 0;
		try {
			structurals = indexAllocator.apply(newCapacity + 1);
		} catch (OutOfMemoryError e) {
			allocationFailed = true;
			throw ErrorTaxonomy.outOfMemory(e);
		}
		capacity = newCapacity;
	}

	public final class Lease implements AutoCloseable {
		private boolean closed = false;

		private Lease() {}

		@Override
		public void close() {
			if (!closed) {
				closed = true;
				busy.set(false);
			}
		}
	}

	@Override
	public String toString() {
		return "ScanEngine(capacity=" + capacity + ", maxCapacity=" + maxCapacity + ", maxDepth=" + maxDepth + ", generation=" + generation + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ScanEngine.class);
}
