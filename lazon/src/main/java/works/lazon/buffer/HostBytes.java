package works.lazon.buffer;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A mutable byte string owned by the host application,
 * with a logical length, a reserved capacity, and a one-way frozen flag.
 * <p>
 * Each instance occupies a range of a simulated address space.
 * Its backing array extends to the end of the last {@link #MAPPING_GRANULARITY mapped page}
 * that the reserved capacity touches, because that memory is readable
 * even though it doesn't belong to this string.
 * That's what lets {@link BufferManager} scan a string in place
 * when its end is far enough from a page boundary.
 * <p>
 * Once {@link #freeze() frozen}, every mutator throws {@link IllegalStateException}.
 * Freezing is how the scanner is assured that bytes it is reading can't change underneath it.
 */
public final class HostBytes {
	/**
	 * The size of the pages in which the simulated address space is mapped.
	 */
	public static final int MAPPING_GRANULARITY = 4096;

	/**
	 * Allocations are aligned like a typical allocator would align them.
	 */
	static final int ALIGNMENT = 16;

	private byte[] storage;
	private long address;
	private int capacity;
	private int length;
	private boolean frozen;

	private HostBytes(long address, int capacity) {
		this.address = address;
		this.capacity = capacity;
		this.storage = new byte[readableExtent(address, capacity)];
	}

	public static HostBytes allocate(int capacity) {
		return new HostBytes(ALLOCATOR.next(capacity), capacity);
	}

	/**
	 * Places a new string at a particular simulated address.
	 * Mostly for tests that need to control where the string ends relative to a page boundary.
	 */
	public static HostBytes allocateAt(long address, int capacity) {
		if (address < 0) {
			throw new IllegalArgumentException("Address can't be negative: " + address);
		}
		return new HostBytes(address, capacity);
	}

	public static HostBytes of(byte[] bytes) {
		HostBytes result = allocate(bytes.length);
		return result.append(bytes);
	}

	public static HostBytes of(String text) {
		return of(text.getBytes(UTF_8));
	}

	public int length() {
		return length;
	}

	public int capacity() {
		return capacity;
	}

	public long address() {
		return address;
	}

	public boolean isFrozen() {
		return frozen;
	}

	public HostBytes freeze() {
		frozen = true;
		return this;
	}

	public byte byteAt(int index) {
		if (index < 0 || index >= length) {
			throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length);
		}
		return storage[index];
	}

	public HostBytes append(byte[] bytes) {
		return append(bytes, 0, bytes.length);
	}

	public HostBytes append(byte[] bytes, int offset, int count) {
		checkNotFrozen();
		int newLength = Math.addExact(length, count);
		ensureCapacity(newLength);
		System.arraycopy(bytes, offset, storage, length, count);
		length = newLength;
		return this;
	}

	public HostBytes append(String text) {
		return append(text.getBytes(UTF_8));
	}

	public HostBytes setByte(int index, byte value) {
		checkNotFrozen();
		if (index < 0 || index >= length) {
			throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length);
		}
		storage[index] = value;
		return this;
	}

	public HostBytes clear() {
		checkNotFrozen();
		length = 0;
		return this;
	}

	/**
	 * @return an unfrozen copy with the same contents
	 */
	public HostBytes dup() {
		return allocate(length).append(storage, 0, length);
	}

	public byte[] toByteArray() {
		return Arrays.copyOf(storage, length);
	}

	@Override
	public String toString() {
		return new String(storage, 0, length, UTF_8);
	}

	/**
	 * The backing array. Bytes beyond {@link #length()} are readable but meaningless.
	 */
	byte[] storage() {
		return storage;
	}

	/**
	 * Sets the logical length, zero-filling and reallocating as needed,
	 * the way a host runtime's string resize does.
	 */
	void resize(int newLength) {
		checkNotFrozen();
		ensureCapacity(newLength);
		if (newLength > length) {
			Arrays.fill(storage, length, newLength, (byte) 0);
		}
		length = newLength;
	}

	/**
	 * Shortens a frozen string without touching its storage.
	 * The bytes past the new length become padding.
	 */
	void restoreLength(int newLength) {
		assert newLength <= length;
		length = newLength;
	}

	private void ensureCapacity(int required) {
		if (required <= capacity) {
			return;
		}
		int newCapacity = Math.max(required, capacity + (capacity >> 1));
		long newAddress = ALLOCATOR.next(newCapacity);
		byte[] newStorage = new byte[readableExtent(newAddress, newCapacity)];
		System.arraycopy(storage, 0, newStorage, 0, length);
		storage = newStorage;
		address = newAddress;
		capacity = newCapacity;
	}

	private void checkNotFrozen() {
		if (frozen) {
			throw new IllegalStateException("Can't modify frozen HostBytes");
		}
	}

	/**
	 * @return the number of readable bytes from {@code address} to the end of the page
	 * containing the last reserved byte
	 */
	static int readableExtent(long address, int capacity) {
		long end = address + Math.max(capacity, 1);
		long pageEnd = (end + MAPPING_GRANULARITY - 1) & -MAPPING_GRANULARITY;
		return Math.toIntExact(pageEnd - address);
	}

	private static final class BumpAllocator {
		private final AtomicLong next = new AtomicLong(MAPPING_GRANULARITY);

		long next(int capacity) {
			long size = (Math.max(capacity, 1) + ALIGNMENT - 1) & -ALIGNMENT;
			return next.getAndAdd(size);
		}
	}

	private static final BumpAllocator ALLOCATOR = new BumpAllocator();
}
