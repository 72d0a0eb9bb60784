/**
 * The low-level scanner.
 * <p>
 * {@link works.lazon.scan.ScanEngine#iterate} validates UTF-8 and records the offset of every token in one pass.
 * {@link works.lazon.scan.JsonIterator} then walks that index, decoding strings and numbers
 * only when asked. This layer is not really meant to be used directly;
 * {@link works.lazon.document.LazyDocument} provides a much more useful API on top of it.
 */
package works.lazon.scan;
