package works.lazon.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lazon.buffer.BufferView;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorKind;
import works.lazon.exceptions.ErrorTaxonomy;
import works.lazon.exceptions.JsonException;
import works.lazon.exceptions.JsonNavigationException;
import works.lazon.scan.JsonIterator;
import works.lazon.scan.JsonType;
import works.lazon.scan.ScanEngine;
import works.lazon.value.JsonValue;
import works.lazon.value.ValueMaterializer;

import static java.util.Objects.requireNonNull;
import static works.lazon.document.DocumentState.ACTIVE;
import static works.lazon.document.DocumentState.DEAD;
import static works.lazon.document.DocumentState.FRESH;
import static works.lazon.document.DocumentState.STALE;

/**
 * A scanned document whose values are materialized only when read.
 * <p>
 * The underlying {@link JsonIterator} only moves forward, so random access is
 * achieved by seeking back to the root and reading forward again.
 * The document keeps its {@link BufferView} and its {@link ScanEngine}
 * so that, if the engine is reused for another document, this one can
 * re-run the scan ("rehydrate") the next time it's read.
 * <p>
 * Lookups ({@link #get}, {@link #findField}, {@link #at}, {@link #atPointer}, {@link #atPath},
 * {@link #atPathWithWildcard}) report missing values as empty rather than throwing.
 * Any other problem is thrown as a {@link JsonException}.
 * <p>
 * Not thread safe. Visitors passed to the enumeration methods run while the
 * engine is leased, so they can't use any document that shares this one's engine.
 */
public final class LazyDocument {
	private final BufferView view;
	private final ScanEngine engine;
	private final ValueMaterializer materializer;

	private JsonIterator iterator;
	private DocumentState state;
	private JsonException causeOfDeath;

	/**
	 * How much of the root value the cursor has consumed.
	 */
	private enum RootPhase {
		UNSTARTED,

		/**
		 * Inside the root object. {@link #nextMember} says where.
		 */
		MEMBERS,

		/**
		 * Somewhere inside the root array.
		 */
		ELEMENTS,

		CONSUMED,
	}

	private static final int NO_MORE_MEMBERS = -1;

	private RootPhase phase;
	private int firstMember;
	private int nextMember;

	/**
	 * True when {@link #nextMember} points at the separator after the last match rather than at a member.
	 */
	private boolean separatorPending;

	private LazyDocument(BufferView view, ScanEngine engine, ValueMaterializer materializer) {
		this.view = requireNonNull(view);
		this.engine = requireNonNull(engine);
		this.materializer = requireNonNull(materializer);
		this.iterator = engine.iterate(view);
		this.state = FRESH;
		resetRoot();
	}

	/**
	 * Scans {@code view} with {@code engine}, invalidating anything the engine previously scanned.
	 */
	public static LazyDocument iterate(BufferView view, ScanEngine engine) {
		return new LazyDocument(view, engine, ValueMaterializer.withStringKeys());
	}

	public static LazyDocument iterate(BufferView view, ScanEngine engine, ValueMaterializer materializer) {
		return new LazyDocument(view, engine, materializer);
	}

	public BufferView view() {
		return view;
	}

	public DocumentState state() {
		refreshState();
		return state;
	}

	public boolean isAlive() {
		return state().isAlive();
	}

	//
	// Keyed lookup
	//

	/**
	 * Same as {@link #findFieldUnordered}.
	 */
	public Optional<JsonValue> get(String key) {
		return findFieldUnordered(key);
	}

	/**
	 * Searches the root object's members from the current position onward,
	 * wrapping around to the first member if necessary.
	 * Repeated lookups in document order are therefore cheap.
	 *
	 * @return the value of the first member named {@code key} found from the current position,
	 * or empty if there's no such member or the root isn't an object
	 */
	public Optional<JsonValue> findFieldUnordered(String key) {
		requireNonNull(key);
		return lookup(() -> searchMembers(key, true));
	}

	/**
	 * Like {@link #findFieldUnordered}, but searches only forward from the current position.
	 * A miss leaves the cursor at the end of the root object.
	 */
	public Optional<JsonValue> findField(String key) {
		requireNonNull(key);
		return lookup(() -> searchMembers(key, false));
	}

	/**
	 * @throws JsonNavigationException with {@link ErrorCode#NO_SUCH_FIELD} if there's no such member
	 */
	public JsonValue fetch(String key) {
		return get(key).orElseThrow(() -> ErrorTaxonomy.exceptionFor(ErrorCode.NO_SUCH_FIELD, "key not found: \"" + key + "\"", null));
	}

	public JsonValue fetch(String key, JsonValue defaultValue) {
		return get(key).orElse(defaultValue);
	}

	/**
	 * @param fallback called with {@code key} if there's no such member
	 */
	public JsonValue fetch(String key, Function<String, JsonValue> fallback) {
		Optional<JsonValue> result = get(key);
		if (result.isPresent()) {
			return result.get();
		} else {
			return fallback.apply(key);
		}
	}

	//
	// Indexed lookup
	//

	/**
	 * Same as {@link #at}.
	 */
	public Optional<JsonValue> get(int index) {
		return at(index);
	}

	/**
	 * Seeks back to the root and reads forward to the given element of the root array.
	 *
	 * @return the element, or empty if the index is out of bounds or the root isn't an array
	 */
	public Optional<JsonValue> at(int index) {
		return lookup(() -> element(index));
	}

	/**
	 * @throws JsonNavigationException with {@link ErrorCode#INDEX_OUT_OF_BOUNDS} if there's no such element
	 */
	public JsonValue fetch(int index) {
		return at(index).orElseThrow(() -> ErrorTaxonomy.exceptionFor(ErrorCode.INDEX_OUT_OF_BOUNDS, "index not found: " + index, null));
	}

	public JsonValue fetch(int index, JsonValue defaultValue) {
		return at(index).orElse(defaultValue);
	}

	public JsonValue fetch(int index, IntFunction<JsonValue> fallback) {
		Optional<JsonValue> result = at(index);
		if (result.isPresent()) {
			return result.get();
		} else {
			return fallback.apply(index);
		}
	}

	//
	// Path queries
	//

	/**
	 * @param pointer an RFC 6901 JSON pointer, either plain or as a {@code #} URI fragment;
	 * the empty string addresses the root
	 * @throws works.lazon.exceptions.JsonPathException if {@code pointer} is malformed
	 */
	public Optional<JsonValue> atPointer(String pointer) {
		List<PathSegment> path = PathResolver.parsePointer(pointer);
		return lookup(() -> resolveAndMaterialize(path));
	}

	/**
	 * @param path a path like {@code $.a[0]['b']}
	 * @throws works.lazon.exceptions.JsonPathException if {@code path} is malformed or contains a wildcard
	 */
	public Optional<JsonValue> atPath(String path) {
		List<PathSegment> segments = PathResolver.parsePath(path, false);
		return lookup(() -> resolveAndMaterialize(segments));
	}

	/**
	 * @return every value matching {@code path}, in document order
	 */
	public List<JsonValue> atPathWithWildcard(String path) {
		List<JsonValue> result = new ArrayList<>();
		atPathWithWildcard(path, result::add);
		return Collections.unmodifiableList(result);
	}

	/**
	 * Passes every value matching {@code path} to {@code visitor}, in document order.
	 * All matches are materialized before the first call to {@code visitor},
	 * so a malformed match produces no calls at all.
	 */
	public LazyDocument atPathWithWildcard(String path, Consumer<? super JsonValue> visitor) {
		requireNonNull(visitor);
		List<PathSegment> segments = PathResolver.parsePath(path, true);
		navigate(() -> {
			List<JsonValue> matches = new ArrayList<>();
			try {
				for (int checkpoint : PathResolver.resolveAll(iterator, segments)) {
					iterator.seek(checkpoint);
					matches.add(materializer.materialize(iterator));
				}
			} finally {
				rewindCursor();
			}
			matches.forEach(visitor);
			return null;
		});
		return this;
	}

	//
	// Enumeration
	//

	/**
	 * @return the elements of the root array
	 * @throws works.lazon.exceptions.JsonUsageException with {@link ErrorCode#OUT_OF_ORDER_ITERATION}
	 * if the root has already been partly read; call {@link #rewind()} first
	 */
	public List<JsonValue> arrayEach() {
		List<JsonValue> result = new ArrayList<>();
		arrayEach(result::add);
		return Collections.unmodifiableList(result);
	}

	/**
	 * Passes each element of the root array to {@code visitor}, in order.
	 * If {@code visitor} throws, the cursor stays where it was.
	 */
	public LazyDocument arrayEach(Consumer<? super JsonValue> visitor) {
		requireNonNull(visitor);
		navigate(() -> {
			beginEnumeration();
			if (iterator.enterArray()) {
				do {
					visitor.accept(materializer.materialize(iterator));
				} while (iterator.nextElement());
			}
			iterator.expectEnd();
			return null;
		});
		return this;
	}

	/**
	 * @return the members of the root object, in document order.
	 * If a key appears more than once, the last value wins.
	 */
	public Map<String, JsonValue> objectEach() {
		Map<String, JsonValue> result = new LinkedHashMap<>();
		objectEach(result::put);
		return Collections.unmodifiableMap(result);
	}

	public LazyDocument objectEach(BiConsumer<? super String, ? super JsonValue> visitor) {
		requireNonNull(visitor);
		navigate(() -> {
			beginEnumeration();
			if (iterator.enterObject()) {
				do {
					String key = materializer.convertKey(iterator.fieldKey());
					visitor.accept(key, materializer.materialize(iterator));
				} while (iterator.nextField());
			}
			iterator.expectEnd();
			return null;
		});
		return this;
	}

	/**
	 * Materializes the entire document.
	 */
	public JsonValue value() {
		return navigate(() -> {
			iterator.rewind();
			phase = RootPhase.CONSUMED;
			return materializer.materializeDocument(iterator);
		});
	}

	//
	// Restarting
	//

	/**
	 * Moves the cursor back to the root without rescanning.
	 * Does nothing if the document is stale, since the next read will start from the root anyway.
	 *
	 * @throws works.lazon.exceptions.JsonUsageException with {@link ErrorCode#DOCUMENT_DEAD} if the document is dead
	 */
	public LazyDocument rewind() {
		refreshState();
		switch (state) {
			case DEAD -> throw documentDead();
			case STALE -> LOGGER.trace("Rewind of stale document is a no-op");
			default -> {
				try (var lease = engine.acquire()) {
					rewindCursor();
					state = FRESH;
				}
			}
		}
		return this;
	}

	/**
	 * Rescans the document, whatever its state. A dead document that rescans successfully comes back to life.
	 */
	public LazyDocument reiterate() {
		LOGGER.debug("Reiterating document in state {}", state);
		scan();
		causeOfDeath = null;
		return this;
	}

	//
	// Internals
	//

	private void refreshState() {
		if (state.isAlive() && !iterator.isValid()) {
			LOGGER.debug("Document is stale: engine generation {} != {}", engine.generation(), iterator.generation());
			state = STALE;
		}
	}

	private void ensureAlive() {
		refreshState();
		if (state == DEAD) {
			throw documentDead();
		} else if (state == STALE) {
			LOGGER.debug("Rehydrating stale document");
			scan();
		}
	}

	/**
	 * Runs the scan again and lands in {@link DocumentState#FRESH FRESH}, or dies trying.
	 * A scan the engine refuses outright, as when it's {@link ErrorCode#PARSER_IN_USE in use},
	 * leaves a document whose cursor is still valid as it was.
	 */
	private void scan() {
		try {
			iterator = engine.iterate(view);
		} catch (JsonException e) {
			if (e.kind() == ErrorKind.STRUCTURAL_MISUSE && state.isAlive() && iterator.isValid()) {
				LOGGER.debug("Scan refused; document unchanged: {}", e.getMessage());
				throw e;
			}
			LOGGER.warn("Document died: {}", e.getMessage());
			state = DEAD;
			causeOfDeath = e;
			throw e;
		}
		resetRoot();
		state = FRESH;
	}

	private JsonException documentDead() {
		String message = ErrorCode.DOCUMENT_DEAD.message();
		if (causeOfDeath != null) {
			message += " (" + causeOfDeath.getMessage() + ")";
		}
		return ErrorTaxonomy.exceptionFor(ErrorCode.DOCUMENT_DEAD, message, causeOfDeath);
	}

	/**
	 * Runs {@code operation} on a live document while holding the engine's lease.
	 */
	private <T> T navigate(Supplier<T> operation) {
		ensureAlive();
		try (var lease = engine.acquire()) {
			state = ACTIVE;
			return operation.get();
		}
	}

	private Optional<JsonValue> lookup(Supplier<JsonValue> operation) {
		try {
			return Optional.of(navigate(operation));
		} catch (JsonNavigationException e) {
			LOGGER.trace("Lookup miss: {}", e.getMessage());
			return Optional.empty();
		}
	}

	private void resetRoot() {
		phase = RootPhase.UNSTARTED;
		firstMember = NO_MORE_MEMBERS;
		nextMember = NO_MORE_MEMBERS;
		separatorPending = false;
	}

	private void rewindCursor() {
		iterator.rewind();
		resetRoot();
	}

	private void beginEnumeration() {
		if (!iterator.isAtRoot() || phase != RootPhase.UNSTARTED) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.OUT_OF_ORDER_ITERATION, "(rewind the document first)");
		}
		if (iterator.isScalar()) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.SCALAR_DOCUMENT_AS_VALUE);
		}
		phase = RootPhase.CONSUMED;
	}

	/**
	 * Positions the cursor inside the root object, entering it if necessary.
	 */
	private void enterRootObject() {
		if (phase == RootPhase.MEMBERS) {
			return;
		}
		iterator.rewind();
		resetRoot();
		if (iterator.peekType() != JsonType.OBJECT) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.INCORRECT_TYPE, "(root is not an object)");
		}
		phase = RootPhase.MEMBERS;
		if (iterator.enterObject()) {
			firstMember = iterator.checkpoint();
			nextMember = firstMember;
		}
	}

	private JsonValue searchMembers(String key, boolean wrap) {
		enterRootObject();
		consumePendingSeparator();
		int start = nextMember;
		if (start == NO_MORE_MEMBERS) {
			start = wrap ? firstMember : NO_MORE_MEMBERS;
		}
		if (start == NO_MORE_MEMBERS) {
			throw noSuchField(key);
		}
		int position = start;
		do {
			iterator.seek(position);
			if (iterator.fieldKey().equals(key)) {
				JsonValue result = materializer.materialize(iterator);
				nextMember = iterator.checkpoint();
				separatorPending = true;
				return result;
			}
			iterator.skipValue();
			if (iterator.nextField()) {
				position = iterator.checkpoint();
			} else if (wrap) {
				position = firstMember;
			} else {
				nextMember = NO_MORE_MEMBERS;
				throw noSuchField(key);
			}
		} while (position != start);
		throw noSuchField(key);
	}

	private void consumePendingSeparator() {
		if (separatorPending) {
			iterator.seek(nextMember);
			nextMember = iterator.nextField() ? iterator.checkpoint() : NO_MORE_MEMBERS;
			separatorPending = false;
		}
	}

	private static JsonException noSuchField(String key) {
		return ErrorTaxonomy.exceptionFor(ErrorCode.NO_SUCH_FIELD, "'" + key + "'");
	}

	private JsonValue element(int index) {
		iterator.rewind();
		resetRoot();
		phase = RootPhase.ELEMENTS;
		if (index >= 0 && iterator.enterArray()) {
			int remaining = index;
			do {
				if (remaining-- == 0) {
					return materializer.materialize(iterator);
				}
				iterator.skipValue();
			} while (iterator.nextElement());
		} else if (index < 0) {
			// Still an INCORRECT_TYPE miss if the root isn't an array
			iterator.enterArray();
		}
		throw ErrorTaxonomy.exceptionFor(ErrorCode.INDEX_OUT_OF_BOUNDS, "[" + index + "]");
	}

	private JsonValue resolveAndMaterialize(List<PathSegment> path) {
		try {
			iterator.seek(PathResolver.resolveOne(iterator, path));
			return materializer.materialize(iterator);
		} finally {
			rewindCursor();
		}
	}

	@Override
	public String toString() {
		return "LazyDocument(state=" + state + ", length=" + view.length() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LazyDocument.class);
}
