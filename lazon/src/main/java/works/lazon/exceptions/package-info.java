/**
 * The exceptions Lazon throws.
 * Every one carries an {@link works.lazon.exceptions.ErrorCode}, and its class is
 * determined by that code's {@link works.lazon.exceptions.ErrorKind}.
 */
package works.lazon.exceptions;
