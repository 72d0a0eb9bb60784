/**
 * Padded input buffers.
 * The scanner reads a fixed number of bytes past the end of every document,
 * so {@link works.lazon.buffer.BufferManager} either proves that an input already
 * has that slack or copies it into a {@link works.lazon.buffer.PaddedBuffer} that does.
 */
package works.lazon.buffer;
