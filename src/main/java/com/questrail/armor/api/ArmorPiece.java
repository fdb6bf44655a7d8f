package com.questrail.armor.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ArmorPiece
 * -----------------------------------------------------------------------------
 * One contiguous armor plate, described as an ordered list of triangles.
 *
 * <h2>Flattening</h2>
 * On the wire a piece is a plain vertex sequence (three vertices per
 * triangle). {@link #vertices()} produces that sequence and
 * {@link #fromVertices(List)} performs the reverse grouping. Any finer
 * grouping information is not stored by the container.
 *
 * Immutable; the triangle list is copied on construction.
 */
public final class ArmorPiece
{
    private static final ArmorPiece EMPTY = new ArmorPiece(List.of());

    private final List<Triangle> triangles;

    private ArmorPiece(List<Triangle> triangles) {
        this.triangles = triangles;
    }

    /**
     * Creates a piece from the given triangles.
     */
    public static ArmorPiece of(List<Triangle> triangles) {
        Objects.requireNonNull(triangles, "triangles");
        return triangles.isEmpty() ? EMPTY : new ArmorPiece(List.copyOf(triangles));
    }

    public static ArmorPiece of(Triangle... triangles) {
        return of(List.of(triangles));
    }

    /**
     * Groups a flat vertex sequence into consecutive triangles.
     *
     * @throws IllegalArgumentException if the number of vertices is not a multiple of 3
     */
    public static ArmorPiece fromVertices(List<Vertex> vertices) {
        Objects.requireNonNull(vertices, "vertices");
        if (vertices.size() % 3 != 0) {
            throw new IllegalArgumentException(
                    "Vertex count must be a multiple of 3 (was " + vertices.size() + ")");
        }

        List<Triangle> grouped = new ArrayList<>(vertices.size() / 3);
        for (int i = 0; i < vertices.size(); i += 3) {
            grouped.add(new Triangle(vertices.get(i), vertices.get(i + 1), vertices.get(i + 2)));
        }
        return of(grouped);
    }

    public List<Triangle> triangles() {
        return triangles;
    }

    /**
     * Returns the flattened vertex sequence in triangle order.
     */
    public List<Vertex> vertices() {
        List<Vertex> flat = new ArrayList<>(vertexCount());
        for (Triangle t : triangles) {
            flat.add(t.a());
            flat.add(t.b());
            flat.add(t.c());
        }
        return flat;
    }

    public int triangleCount() {
        return triangles.size();
    }

    public int vertexCount() {
        return triangles.size() * 3;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArmorPiece that)) return false;
        return triangles.equals(that.triangles);
    }

    @Override
    public int hashCode() {
        return triangles.hashCode();
    }

    @Override
    public String toString() {
        return "ArmorPiece[triangles=" + triangles.size() + "]";
    }
}
