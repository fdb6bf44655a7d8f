package com.questrail.armor.api;

import com.questrail.armor.core.ArmorRecordBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ArmorRecord
 * -----------------------------------------------------------------------------
 * The in-memory form of one armor model block: an ordered mapping from
 * {@link PieceId} to {@link ArmorPiece}.
 *
 * <h2>Ordering</h2>
 * Iteration order is insertion order. It determines the order in which pieces
 * are serialized and therefore affects the produced bytes, but not the
 * meaning of the record. Two records are equal only if they list the same
 * pieces in the same order.
 *
 * <h2>Empty record</h2>
 * A record without pieces is the "no armor block" state. It serializes to a
 * distinct, shorter container shape; see the codec package.
 */
public final class ArmorRecord
{
    private static final ArmorRecord EMPTY = new ArmorRecord(new LinkedHashMap<>());

    private final Map<PieceId, ArmorPiece> pieces;

    private ArmorRecord(LinkedHashMap<PieceId, ArmorPiece> pieces) {
        this.pieces = Collections.unmodifiableMap(pieces);
    }

    /**
     * Creates a record from an ordered map. The map is copied.
     */
    public static ArmorRecord of(Map<PieceId, ArmorPiece> pieces) {
        Objects.requireNonNull(pieces, "pieces");
        if (pieces.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<PieceId, ArmorPiece> copy = new LinkedHashMap<>();
        pieces.forEach((id, piece) -> copy.put(
                Objects.requireNonNull(id, "piece id"),
                Objects.requireNonNull(piece, "piece")));
        return new ArmorRecord(copy);
    }

    public static ArmorRecord empty() {
        return EMPTY;
    }

    public static ArmorRecordBuilder builder() {
        return new ArmorRecordBuilder();
    }

    /**
     * Returns an unmodifiable, insertion-ordered view of the pieces.
     */
    public Map<PieceId, ArmorPiece> pieces() {
        return pieces;
    }

    public Optional<ArmorPiece> get(PieceId id) {
        return Optional.ofNullable(pieces.get(id));
    }

    public int size() {
        return pieces.size();
    }

    public boolean isEmpty() {
        return pieces.isEmpty();
    }

    /**
     * Total number of vertices over all pieces.
     */
    public long vertexCount() {
        long total = 0;
        for (ArmorPiece piece : pieces.values()) {
            total += piece.vertexCount();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArmorRecord that)) return false;
        // Map.equals ignores order; compare entry sequences instead.
        return pieces.size() == that.pieces.size()
                && pieces.entrySet().stream().toList()
                        .equals(that.pieces.entrySet().stream().toList());
    }

    @Override
    public int hashCode() {
        return pieces.hashCode();
    }

    @Override
    public String toString() {
        return "ArmorRecord[pieces=" + pieces.size() + ", vertices=" + vertexCount() + "]";
    }
}
