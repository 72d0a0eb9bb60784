/**
 * Entry points for parsing, loading and generating JSON.
 * {@link works.lazon.Json} covers the common cases with a per-thread {@link works.lazon.Parser};
 * {@link works.lazon.JsonConfig} holds the limits every parser enforces.
 */
package works.lazon;
