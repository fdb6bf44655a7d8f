package com.questrail.armor.geometry.codec;

/**
 * Classification of armor geometry codec failures.
 *
 * <p>Every failure is fatal to the whole encode or decode call. The kind lets
 * callers distinguish a damaged or truncated file from one whose layout no
 * longer matches the expected format.</p>
 */
public enum ArmorGeometryError
{
    /**
     * Block count outside {0, 1}, a bad armor section pointer, a non-zero
     * spacer, or a buffer that ends before a fixed-size header field.
     */
    MALFORMED_HEADER,

    /**
     * A declared piece or vertex count, or the section name, runs past the end
     * of the buffer.
     */
    TRUNCATED_CONTENT,

    /**
     * A piece declares a vertex count that cannot be grouped into triangles.
     */
    VERTEX_COUNT_NOT_MULTIPLE_OF_THREE,

    /**
     * A piece id does not fit in an unsigned 32-bit field.
     */
    ID_OVERFLOW,

    /**
     * The recomputed content digest differs from the expected one.
     */
    HASH_MISMATCH,

    /**
     * The stored content length or section name position disagrees with the
     * bytes actually consumed by the content region.
     */
    CONTENT_LENGTH_MISMATCH,

    /**
     * The trailing section name is not {@code "CM_PA_united.armor\0"}.
     */
    INVALID_SECTION_NAME,

    /**
     * The same piece id occurs twice in one armor section.
     */
    DUPLICATE_PIECE_ID,

    /**
     * The encoded container would not fit in a single byte array.
     */
    CONTENT_TOO_LARGE
}
