/**
 * Lazy, cursor-based access to a scanned document.
 * <p>
 * A {@link works.lazon.document.LazyDocument} borrows the scratch memory of the
 * {@link works.lazon.scan.ScanEngine} that scanned it.
 * When that engine scans something else, the document goes
 * {@link works.lazon.document.DocumentState#STALE stale} and rescans itself on its next read.
 * Lookups that find nothing return an empty {@link java.util.Optional};
 * everything else that goes wrong is thrown.
 */
package works.lazon.document;
