package com.questrail.armor.geometry.codec;

import com.questrail.armor.api.ArmorContentHash;

import java.util.Objects;
import java.util.Optional;

/**
 * ArmorGeometryDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for the armor section of a geometry container.
 *
 * <p>This interface defines the inbound boundary between raw container bytes
 * and a structured {@link DecodedArmorGeometry}.</p>
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Validating the container header and the armor section layout</li>
 *   <li>Detecting truncation and inconsistent length or position fields</li>
 *   <li>Recomputing the content metadata and, when asked, verifying the digest</li>
 * </ul>
 *
 * <p>Every defect is fatal. The decoder never returns a partially decoded
 * record; it throws an {@link ArmorGeometryDecodeException} whose
 * {@link ArmorGeometryError} classifies the failure.</p>
 */
public interface ArmorGeometryDecoder
{
    /**
     * Decode a complete container buffer, optionally checking the content
     * digest against a previously recorded one.
     *
     * @param bytes        the complete container bytes
     * @param expectedHash digest the content region must match, if present
     * @return the decoded record and recomputed metadata
     * @throws ArmorGeometryDecodeException if the buffer is malformed or fails verification
     */
    DecodedArmorGeometry decode(byte[] bytes, Optional<ArmorContentHash> expectedHash);

    /**
     * Decode a complete container buffer without digest verification.
     */
    default DecodedArmorGeometry decode(byte[] bytes)
    {
        return decode(bytes, Optional.empty());
    }

    /**
     * Decode a complete container buffer and require its content digest to
     * equal {@code expectedHash}.
     */
    default DecodedArmorGeometry decode(byte[] bytes, ArmorContentHash expectedHash)
    {
        return decode(bytes, Optional.of(Objects.requireNonNull(expectedHash, "expectedHash")));
    }
}
