package com.questrail.armor.geometry.codec;

import com.questrail.armor.api.ArmorContentMetadata;
import com.questrail.armor.api.ArmorRecord;

import java.util.Objects;

/**
 * Output of an {@link ArmorGeometryDecoder}.
 *
 * <p>{@code record} has its triangles regrouped from the flat vertex stream in
 * groups of three. {@code metadata} is recomputed from the received content
 * region.</p>
 */
public record DecodedArmorGeometry(
        ArmorRecord record,
        ArmorContentMetadata metadata
) {
    public DecodedArmorGeometry {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(metadata, "metadata");
    }
}
