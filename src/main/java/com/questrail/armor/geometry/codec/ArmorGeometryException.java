package com.questrail.armor.geometry.codec;

import java.util.Objects;

/**
 * Base type of all armor geometry codec failures.
 *
 * <p>Callers that only need to know <em>what</em> went wrong inspect
 * {@link #error()}; the subclasses tell the direction.</p>
 */
public abstract class ArmorGeometryException extends RuntimeException
{
    private final ArmorGeometryError error;

    protected ArmorGeometryException(ArmorGeometryError error, String message)
    {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public ArmorGeometryError error()
    {
        return error;
    }
}
