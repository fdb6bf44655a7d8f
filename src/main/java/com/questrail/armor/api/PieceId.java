package com.questrail.armor.api;

import java.util.Objects;

/**
 * Strongly typed identifier of a single armor piece.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * Within an armor section every piece is addressed by an integer id. On the
 * wire the id is an unsigned 32-bit little-endian value. Upstream tooling,
 * however, carries ids as decimal text (JSON object keys), so values that do
 * not fit in 32 bits can reach the codec.
 * </p>
 *
 * <p>
 * This type therefore accepts any non-negative {@code long}. Whether the value
 * is encodable is a wire concern and is checked by the encoder
 * (see {@link #fitsUnsigned32()}).
 * </p>
 *
 * <h2>Layering note</h2>
 * <ul>
 *   <li>No knowledge of byte order or field offsets</li>
 *   <li>No dependency on Netty or on the codec packages</li>
 * </ul>
 */
public final class PieceId
{
    /**
     * Largest id that can be written to the wire.
     */
    public static final long MAX_UNSIGNED_32 = 0xFFFF_FFFFL;

    private final long value;

    private PieceId(long value) {
        this.value = value;
    }

    /**
     * Creates a {@code PieceId} for the given numeric value.
     *
     * @param value the piece id (non-negative)
     * @return a {@code PieceId} instance
     * @throws IllegalArgumentException if the value is negative
     */
    public static PieceId of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException(
                    "Armor piece id must not be negative (was " + value + ")");
        }
        return new PieceId(value);
    }

    /**
     * Parses a decimal piece id, as found in the keys of externally supplied
     * armor documents.
     *
     * @throws IllegalArgumentException if the text is not a non-negative decimal integer
     */
    public static PieceId parse(String text) {
        Objects.requireNonNull(text, "text");
        final long value;
        try {
            value = Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a valid armor piece id: '" + text + "'", e);
        }
        return of(value);
    }

    /**
     * Returns the numeric id.
     */
    public long value() {
        return value;
    }

    /**
     * Returns true if this id can be represented as an unsigned 32-bit integer.
     */
    public boolean fitsUnsigned32() {
        return value <= MAX_UNSIGNED_32;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PieceId that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "PieceId[" + value + "]";
    }
}
