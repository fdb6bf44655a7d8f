package com.questrail.armor.geometry.codec;

import com.questrail.armor.api.ArmorRecord;

/**
 * ArmorGeometryEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for the armor section of a geometry container.
 *
 * <p>This interface defines the outbound boundary between a structured
 * {@link ArmorRecord} and the raw container bytes handed to an output
 * consumer.</p>
 *
 * <p>The encoder is responsible for:</p>
 * <ul>
 *   <li>Producing the container header, padding, and armor section layout</li>
 *   <li>Filling length and position fields that depend on later content</li>
 *   <li>Deriving the content metadata (length and digest)</li>
 * </ul>
 *
 * <p>The encoder is <strong>not</strong> responsible for persisting the bytes
 * or attaching the metadata to any external descriptor.</p>
 */
public interface ArmorGeometryEncoder
{
    /**
     * Encode a record into container bytes.
     *
     * @param record the armor record; an empty record yields the "no armor block" shape
     * @return the encoded bytes together with their content metadata
     * @throws ArmorGeometryEncodeException if the record cannot be represented on the wire
     */
    EncodedArmorGeometry encode(ArmorRecord record);
}
