package com.questrail.armor.core;

import com.questrail.armor.api.ArmorPiece;
import com.questrail.armor.api.ArmorRecord;
import com.questrail.armor.api.PieceId;
import com.questrail.armor.api.Triangle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ArmorRecordBuilder
 * -----------------------------------------------------------------------------
 * Builder for constructing {@link ArmorRecord} instances incrementally.
 *
 * <h2>Purpose</h2>
 * This class exists to:
 * <ul>
 *   <li>Let input suppliers translate parsed armor documents piece by piece</li>
 *   <li>Keep tests and fixtures readable</li>
 * </ul>
 *
 * <h2>Design Notes</h2>
 * <ul>
 *   <li>The builder is mutable; every {@link #build()} returns an independent record</li>
 *   <li>Pieces keep the position of their first insertion</li>
 *   <li>{@link #piece(PieceId, List)} replaces the triangles of an existing piece</li>
 * </ul>
 */
public final class ArmorRecordBuilder
{
    private final Map<PieceId, List<Triangle>> working = new LinkedHashMap<>();

    /**
     * Sets the triangles of a piece.
     */
    public ArmorRecordBuilder piece(PieceId id, List<Triangle> triangles) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(triangles, "triangles");
        working.put(id, new ArrayList<>(triangles));
        return this;
    }

    /**
     * Sets the triangles of a piece identified by a raw numeric id.
     */
    public ArmorRecordBuilder piece(long id, Triangle... triangles) {
        return piece(PieceId.of(id), List.of(triangles));
    }

    /**
     * Appends one triangle to a piece, creating the piece if necessary.
     */
    public ArmorRecordBuilder triangle(PieceId id, Triangle triangle) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(triangle, "triangle");
        working.computeIfAbsent(id, k -> new ArrayList<>()).add(triangle);
        return this;
    }

    /**
     * Returns true if a piece with the given id has been added.
     */
    public boolean contains(PieceId id) {
        return working.containsKey(id);
    }

    /**
     * Builds the {@link ArmorRecord}.
     */
    public ArmorRecord build() {
        Map<PieceId, ArmorPiece> pieces = new LinkedHashMap<>();
        working.forEach((id, triangles) -> pieces.put(id, ArmorPiece.of(triangles)));
        return ArmorRecord.of(pieces);
    }
}
