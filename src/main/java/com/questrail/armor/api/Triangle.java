package com.questrail.armor.api;

import java.util.List;
import java.util.Objects;

/**
 * Three vertices forming one face of an armor piece.
 *
 * <p>The geometry container does not store triangle boundaries. A piece is
 * written as a flat vertex sequence and regrouped into triangles purely by
 * position when read back.</p>
 */
public record Triangle(Vertex a, Vertex b, Vertex c)
{
    public Triangle {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        Objects.requireNonNull(c, "c");
    }

    /**
     * Returns the vertices in wire order: {@code a}, {@code b}, {@code c}.
     */
    public List<Vertex> vertices() {
        return List.of(a, b, c);
    }
}
