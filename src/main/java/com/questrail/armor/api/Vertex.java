package com.questrail.armor.api;

/**
 * A single armor vertex in model space.
 *
 * <p>Coordinates are IEEE-754 single precision values and are carried through
 * unchanged; NaN and infinities are not rejected.</p>
 */
public record Vertex(float x, float y, float z)
{
    public static Vertex of(float x, float y, float z) {
        return new Vertex(x, y, z);
    }
}
