package com.questrail.armor.geometry.codec.impl;

import com.questrail.armor.api.ArmorContentHash;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * ArmorContentDigest
 * -----------------------------------------------------------------------------
 * Computes the MD5 digest of an armor content region.
 *
 * <p>The digest covers exactly the content region: from the first byte of the
 * 36-byte opaque preamble through the last vertex record. The section header
 * fields before it and the section name after it are excluded.</p>
 */
final class ArmorContentDigest
{
    private static final String ALGORITHM = "MD5";

    private ArmorContentDigest() {}

    static ArmorContentHash digest(byte[] data)
    {
        return digest(data, 0, data.length);
    }

    static ArmorContentHash digest(byte[] data, int off, int len)
    {
        final MessageDigest md = newDigest();
        md.update(data, off, len);
        return ArmorContentHash.of(md.digest());
    }

    private static MessageDigest newDigest()
    {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to provide MD5.
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }
}
