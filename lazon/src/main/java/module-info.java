/**
 * The Lazon library for lazily reading JSON documents.
 * <p>
 * Lazon scans a document once to find its structural characters,
 * then materializes only the values a caller actually reads.
 * The usual entry point is {@link works.lazon.Json},
 * or a {@link works.lazon.Parser} when documents must outlive the next parse.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.lazon.document},
 *         the {@link works.lazon.document.LazyDocument LazyDocument} cursor with its keyed, indexed and path lookups;
 *     </li>
 *     <li>
 *         {@link works.lazon.value},
 *         the immutable {@link works.lazon.value.JsonValue JsonValue} tree that lookups return;
 *     </li>
 *     <li>
 *         {@link works.lazon.scan} and {@link works.lazon.buffer},
 *         which find structure in padded input without decoding it; and
 *     </li>
 *     <li>
 *         {@link works.lazon.exceptions},
 *         whose {@link works.lazon.exceptions.ErrorCode ErrorCode} names every way a read can fail.
 *     </li>
 * </ul>
 */
module works.lazon {
	requires org.slf4j;

	exports works.lazon;
	exports works.lazon.buffer;
	exports works.lazon.codec;
	exports works.lazon.document;
	exports works.lazon.exceptions;
	exports works.lazon.scan;
	exports works.lazon.value;
}
