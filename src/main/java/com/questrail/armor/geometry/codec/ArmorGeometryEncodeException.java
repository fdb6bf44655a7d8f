package com.questrail.armor.geometry.codec;

/**
 * Indicates that an {@code ArmorRecord} cannot be represented in the
 * container format.
 *
 * This typically reflects:
 * <ul>
 *   <li>A piece id beyond the unsigned 32-bit range</li>
 *   <li>A record too large for a single buffer</li>
 * </ul>
 */
public final class ArmorGeometryEncodeException extends ArmorGeometryException
{
    public ArmorGeometryEncodeException(ArmorGeometryError error, String message)
    {
        super(error, message);
    }
}
