package com.questrail.armor.geometry.observability;

import com.questrail.armor.api.ArmorContentMetadata;

import java.time.Instant;

/**
 * Record representing a successful encode.
 */
public record ArmorGeometryEncodedEvent(
    Instant timestamp,
    int pieceCount,
    long vertexCount,
    int length,
    ArmorContentMetadata metadata
) {
}
