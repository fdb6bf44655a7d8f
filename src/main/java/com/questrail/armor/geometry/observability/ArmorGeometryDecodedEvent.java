package com.questrail.armor.geometry.observability;

import com.questrail.armor.api.ArmorContentMetadata;

import java.time.Instant;

/**
 * Record representing a successful decode.
 *
 * <p>{@code hashVerified} is true when the caller supplied an expected digest
 * and the content region matched it.</p>
 */
public record ArmorGeometryDecodedEvent(
    Instant timestamp,
    int pieceCount,
    long vertexCount,
    int length,
    ArmorContentMetadata metadata,
    boolean hashVerified
) {
}
