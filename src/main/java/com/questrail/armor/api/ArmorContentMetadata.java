package com.questrail.armor.api;

import java.util.Objects;

/**
 * Length and digest of the content region of an encoded armor section.
 *
 * <p>Always derived from emitted (or received) bytes, never supplied
 * independently. {@code size} is an unsigned 32-bit value.</p>
 *
 * <p>{@code size == 0} with {@link ArmorContentHash#EMPTY} holds exactly for
 * records without pieces.</p>
 */
public record ArmorContentMetadata(
        long size,
        ArmorContentHash hash
) {
    public static final ArmorContentMetadata EMPTY = new ArmorContentMetadata(0, ArmorContentHash.EMPTY);

    public ArmorContentMetadata {
        if (size < 0 || size > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("Content size out of unsigned 32-bit range: " + size);
        }
        Objects.requireNonNull(hash, "hash");
    }
}
