package com.questrail.armor.geometry.codec;

import com.questrail.armor.api.ArmorContentMetadata;

import java.util.Arrays;
import java.util.Objects;

/**
 * EncodedArmorGeometry
 * -----------------------------------------------------------------------------
 * Output of an {@link ArmorGeometryEncoder}: the container bytes plus the
 * metadata derived from their content region.
 *
 * <p>The content region is the byte range
 * {@code [contentOffset, contentOffset + metadata.size)} of {@link #bytes()}.
 * For the empty-record shape there is no content region; the offset is
 * reported as {@code 0} and the size is {@code 0}.</p>
 *
 * Byte arrays are copied on the way in and on the way out.
 */
public final class EncodedArmorGeometry
{
    private final byte[] bytes;
    private final ArmorContentMetadata metadata;
    private final int contentOffset;

    public EncodedArmorGeometry(byte[] bytes, ArmorContentMetadata metadata, int contentOffset)
    {
        Objects.requireNonNull(bytes, "bytes");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        if (contentOffset < 0 || contentOffset + metadata.size() > bytes.length) {
            throw new IllegalArgumentException(
                    "Content region [" + contentOffset + ", " + (contentOffset + metadata.size())
                            + ") lies outside buffer of length " + bytes.length);
        }
        this.bytes = bytes.clone();
        this.contentOffset = contentOffset;
    }

    /**
     * Returns a copy of the container bytes.
     */
    public byte[] bytes()
    {
        return bytes.clone();
    }

    public int length()
    {
        return bytes.length;
    }

    public ArmorContentMetadata metadata()
    {
        return metadata;
    }

    /**
     * Absolute position of the first content-region byte.
     */
    public int contentOffset()
    {
        return contentOffset;
    }

    /**
     * Returns a copy of exactly the bytes covered by {@link #metadata()}.
     */
    public byte[] contentRegion()
    {
        return Arrays.copyOfRange(bytes, contentOffset, contentOffset + (int) metadata.size());
    }

    @Override
    public String toString()
    {
        return "EncodedArmorGeometry[" +
                "length=" + bytes.length +
                ", contentOffset=0x" + Integer.toHexString(contentOffset) +
                ", contentSize=" + metadata.size() +
                ", hash=" + metadata.hash().toHex() +
                ']';
    }
}
