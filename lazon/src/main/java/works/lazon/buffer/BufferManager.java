package works.lazon.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lazon.JsonConfig;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorTaxonomy;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static works.lazon.buffer.PaddedBuffer.PADDING;

/**
 * Decides whether input can be scanned in place or must be copied,
 * and produces a {@link BufferView} with enough padding either way.
 * <p>
 * Any {@link HostBytes} scanned in place is frozen first, and stays frozen.
 */
public final class BufferManager {
	private final JsonConfig config;
	private final PageGeometry geometry;

	public BufferManager(JsonConfig config) {
		this.config = requireNonNull(config);
		this.geometry = new PageGeometry(config.pageSize());
	}

	public JsonConfig config() {
		return config;
	}

	public BufferView view(HostBytes source) {
		int length = source.length();
		if (config.zeroCopyParsing() && canBorrow(source)) {
			LOGGER.debug("Borrowing {} bytes at address {}", length, source.address());
			source.freeze();
			return borrowedView(source, length);
		}

		if (source.isFrozen() || config.debugBuffers()) {
			// Can't grow a frozen string
			LOGGER.debug("Copying {} bytes (frozen={})", length, source.isFrozen());
			return PaddedBuffer.copyOf(source.storage(), 0, length).view();
		}

		int required = paddedLength(length);
		if (source.capacity() < required) {
			LOGGER.debug("Growing {} bytes to {} for padding", length, required);
			try {
				source.resize(required);
			} catch (OutOfMemoryError e) {
				throw ErrorTaxonomy.outOfMemory(e);
			}
			source.freeze();
			source.restoreLength(length);
		} else {
			source.freeze();
		}
		return borrowedView(source, length);
	}

	/**
	 * Java arrays belong to the caller and have no padding, so they are always copied.
	 */
	public BufferView view(byte[] source) {
		return PaddedBuffer.copyOf(source).view();
	}

	public BufferView view(String source) {
		return view(source.getBytes(UTF_8));
	}

	/**
	 * @return {@code length} plus {@link PaddedBuffer#PADDING}
	 * @throws works.lazon.exceptions.JsonResourceException with {@link ErrorCode#OVERSIZE_INPUT}
	 * if that doesn't fit in an array
	 */
	static int paddedLength(int length) {
		if (length > Integer.MAX_VALUE - PADDING) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.OVERSIZE_INPUT, "(" + length + " bytes)");
		}
		return length + PADDING;
	}

	/**
	 * @return true if {@code source} can be scanned where it is, without growing or copying
	 */
	boolean canBorrow(HostBytes source) {
		if (config.debugBuffers()) {
			return false;
		}
		int length = source.length();
		if (length > Integer.MAX_VALUE - PADDING) {
			return false;
		}
		if (geometry.paddingStaysOnLastPage(source.address(), length)
			&& PageGeometry.storageCoversPadding(source.storage(), length)) {
			return true;
		}
		return source.capacity() >= length + PADDING;
	}

	private static BufferView borrowedView(HostBytes source, int length) {
		byte[] storage = source.storage();
		return new BufferView(source, storage, 0, length, storage.length);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BufferManager.class);
}
