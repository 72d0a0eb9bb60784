/**
 * Immutable JSON values, and the {@link works.lazon.value.ValueMaterializer} that builds them from a scan.
 */
package works.lazon.value;
