package com.questrail.armor.geometry.codec;

/**
 * Indicates that a byte buffer could not be decoded into an armor record.
 *
 * <p>{@link #offset()} is the absolute buffer position at which the defect was
 * detected, or {@code -1} when the failure is not tied to one position (for
 * example a digest mismatch).</p>
 */
public final class ArmorGeometryDecodeException extends ArmorGeometryException
{
    private final long offset;

    public ArmorGeometryDecodeException(ArmorGeometryError error, long offset, String message)
    {
        super(error, message);
        this.offset = offset;
    }

    public long offset()
    {
        return offset;
    }
}
