package com.questrail.armor.api;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * ArmorContentHash
 * -----------------------------------------------------------------------------
 * 128-bit MD5 digest of an armor content region.
 *
 * <p>The digest is used by downstream consumers to detect whether cached data
 * derived from an armor model is outdated. Those consumers exchange it as
 * hexadecimal text and compare it without regard to case, so
 * {@link #fromHex(String)} accepts either case and {@link #toHex()} always
 * produces lower case.</p>
 *
 * Byte arrays are copied on the way in and on the way out.
 */
public final class ArmorContentHash
{
    /**
     * Number of bytes in an MD5 digest.
     */
    public static final int LENGTH = 16;

    // Must be initialized before EMPTY, which is parsed with it.
    private static final HexFormat HEX = HexFormat.of();

    /**
     * Digest of zero bytes. This is the hash of every empty armor record.
     */
    public static final ArmorContentHash EMPTY = fromHex("d41d8cd98f00b204e9800998ecf8427e");

    private final byte[] digest;

    private ArmorContentHash(byte[] digest) {
        this.digest = digest;
    }

    /**
     * Wraps a raw 16-byte digest. The array is copied.
     *
     * @throws IllegalArgumentException if the digest is not 16 bytes long
     */
    public static ArmorContentHash of(byte[] digest) {
        Objects.requireNonNull(digest, "digest");
        if (digest.length != LENGTH) {
            throw new IllegalArgumentException(
                    "Armor content hash must be " + LENGTH + " bytes (was " + digest.length + ")");
        }
        return new ArmorContentHash(digest.clone());
    }

    /**
     * Parses 32 hexadecimal digits, in either case.
     *
     * @throws IllegalArgumentException if the text is not a valid 128-bit hex digest
     */
    public static ArmorContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        if (hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException(
                    "Armor content hash must be " + (LENGTH * 2) + " hex digits (was '" + hex + "')");
        }
        return new ArmorContentHash(HEX.parseHex(hex));
    }

    /**
     * Returns a copy of the digest bytes.
     */
    public byte[] bytes() {
        return digest.clone();
    }

    /**
     * Returns the digest as 32 lower-case hexadecimal digits.
     */
    public String toHex() {
        return HEX.formatHex(digest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArmorContentHash that)) return false;
        return Arrays.equals(digest, that.digest);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return "ArmorContentHash[" + toHex() + "]";
    }
}
