/**
 * Generating JSON text from {@link works.lazon.value.JsonValue} trees and plain Java values.
 */
package works.lazon.codec;
