package com.questrail.armor.geometry.codec.impl;

import com.questrail.armor.api.ArmorContentHash;
import com.questrail.armor.api.ArmorContentMetadata;
import com.questrail.armor.api.ArmorRecord;
import com.questrail.armor.geometry.codec.ArmorGeometryDecodeException;
import com.questrail.armor.geometry.codec.ArmorGeometryError;
import com.questrail.armor.geometry.codec.DecodedArmorGeometry;
import com.questrail.armor.geometry.codec.EncodedArmorGeometry;
import com.questrail.armor.geometry.config.ArmorGeometryCodecConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.Arrays;

import static com.questrail.armor.geometry.ArmorFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultArmorGeometryDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultArmorGeometryDecoder}.
 *
 * <p>Valid buffers come from {@link DefaultArmorGeometryEncoder}; defects are
 * introduced by patching individual fields. Every defect must fail the whole
 * decode with the matching {@link ArmorGeometryError}.</p>
 */
final class DefaultArmorGeometryDecoderTest
{
    private final DefaultArmorGeometryEncoder encoder = new DefaultArmorGeometryEncoder();
    private final DefaultArmorGeometryDecoder decoder = new DefaultArmorGeometryDecoder();

    @Test
    void decodeEmptyShape()
    {
        DecodedArmorGeometry decoded = decoder.decode(encoder.encode(ArmorRecord.empty()).bytes());

        assertTrue(decoded.record().isEmpty());
        assertEquals(ArmorContentMetadata.EMPTY, decoded.metadata());
    }

    @Test
    void emptyShapeIgnoresTrailingBytes()
    {
        byte[] bytes = Arrays.copyOf(encoder.encode(ArmorRecord.empty()).bytes(), 0x80);
        Arrays.fill(bytes, 0x44, 0x80, (byte) 0x5A);

        assertTrue(decoder.decode(bytes).record().isEmpty());
    }

    @Test
    void decodeSingleTriangle()
    {
        EncodedArmorGeometry encoded = encoder.encode(singleTriangle());
        DecodedArmorGeometry decoded = decoder.decode(encoded.bytes());

        assertEquals(singleTriangle(), decoded.record());
        assertEquals(120, decoded.metadata().size());
        assertEquals(encoded.metadata(), decoded.metadata());
    }

    @Test
    void decodeFollowsStoredSectionPointer()
    {
        EncodedArmorGeometry encoded = encoder.encode(hull());
        byte[] original = encoded.bytes();

        // Move the armor section 16 bytes further back, as if other sections preceded it.
        byte[] relocated = new byte[original.length + 16];
        System.arraycopy(original, 0, relocated, 0, SECTION);
        Arrays.fill(relocated, SECTION, SECTION + 16, (byte) 0xFF);
        System.arraycopy(original, SECTION, relocated, SECTION + 16, original.length - SECTION);
        putIntLE(relocated, 0x40, SECTION + 16);

        DecodedArmorGeometry decoded = decoder.decode(relocated);
        assertEquals(hull(), decoded.record());
        assertEquals(encoded.metadata(), decoded.metadata());
    }

    @Test
    void trailingBytesAfterSectionNameAreIgnored()
    {
        byte[] original = encoder.encode(singleTriangle()).bytes();
        byte[] extended = Arrays.copyOf(original, original.length + 64);

        assertEquals(singleTriangle(), decoder.decode(extended).record());
    }

    @Test
    void rejectsBlockWithoutPieces()
    {
        byte[] single = encoder.encode(singleTriangle()).bytes();
        byte[] name = ArmorGeometryLayout.sectionName();

        // Header and section header of a real buffer, then a content region with a piece count of 0.
        byte[] bytes = new byte[CONTENT_START + 40 + name.length];
        System.arraycopy(single, 0, bytes, 0, CONTENT_START);
        Arrays.fill(bytes, CONTENT_START, PIECE_COUNT_FIELD, (byte) 0xFF);
        System.arraycopy(name, 0, bytes, CONTENT_START + 40, name.length);
        putIntLE(bytes, CONTENT_LENGTH_FIELD, 40);
        putIntLE(bytes, NAME_POSITION_FIELD, 16 + 40);

        ArmorGeometryDecodeException e = assertDecodeFails(ArmorGeometryError.MALFORMED_HEADER, bytes);
        assertEquals(PIECE_COUNT_FIELD, e.offset());
    }

    @Test
    void rejectsUnknownBlockCount()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, 20, 2);

        ArmorGeometryDecodeException e = assertDecodeFails(ArmorGeometryError.MALFORMED_HEADER, bytes);
        assertEquals(20, e.offset());
    }

    @Test
    void rejectsBufferShorterThanBlockCount()
    {
        assertDecodeFails(ArmorGeometryError.MALFORMED_HEADER, new byte[23]);
        assertDecodeFails(ArmorGeometryError.MALFORMED_HEADER, new byte[0]);
    }

    @Test
    void rejectsSectionPointerIntoHeader()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, 0x40, 0x20);

        assertDecodeFails(ArmorGeometryError.MALFORMED_HEADER, bytes);
    }

    @Test
    void rejectsSectionPointerPastEnd()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, 0x40, bytes.length + 1);

        assertDecodeFails(ArmorGeometryError.MALFORMED_HEADER, bytes);
    }

    @Test
    void rejectsNonZeroSpacer()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        bytes[CONTENT_LENGTH_FIELD + 4] = 0x01;

        ArmorGeometryDecodeException e = assertDecodeFails(ArmorGeometryError.MALFORMED_HEADER, bytes);
        assertEquals(CONTENT_LENGTH_FIELD + 4, e.offset());
    }

    @Test
    void rejectsNonZeroPointerSpacer()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        bytes[0x47] = 0x01;

        assertDecodeFails(ArmorGeometryError.MALFORMED_HEADER, bytes);
    }

    @Test
    void toleratesNonZeroSpacerWhenCheckDisabled()
    {
        DefaultArmorGeometryDecoder lenient = new DefaultArmorGeometryDecoder(
                ArmorGeometryCodecConfig.builder().withVerifyZeroSpacers(false).build());

        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        bytes[CONTENT_LENGTH_FIELD + 4] = 0x01;
        bytes[NAME_POSITION_FIELD + 7] = 0x7F;

        assertEquals(singleTriangle(), lenient.decode(bytes).record());
    }

    @Test
    void rejectsStoredContentLengthMismatch()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, CONTENT_LENGTH_FIELD, 121);

        assertDecodeFails(ArmorGeometryError.CONTENT_LENGTH_MISMATCH, bytes);
    }

    @Test
    void rejectsStoredSectionNamePositionMismatch()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, NAME_POSITION_FIELD, 137);

        ArmorGeometryDecodeException e =
                assertDecodeFails(ArmorGeometryError.CONTENT_LENGTH_MISMATCH, bytes);
        assertEquals(NAME_POSITION_FIELD, e.offset());
    }

    @Test
    void rejectsVertexCountNotMultipleOfThree()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, FIRST_VERTEX_COUNT_FIELD, 2);

        ArmorGeometryDecodeException e =
                assertDecodeFails(ArmorGeometryError.VERTEX_COUNT_NOT_MULTIPLE_OF_THREE, bytes);
        assertEquals(FIRST_VERTEX_COUNT_FIELD, e.offset());
    }

    @Test
    void rejectsVertexCountBeyondBuffer()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, FIRST_VERTEX_COUNT_FIELD, 300);

        assertDecodeFails(ArmorGeometryError.TRUNCATED_CONTENT, bytes);
    }

    @Test
    void rejectsHugeVertexCountWithoutAllocating()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, FIRST_VERTEX_COUNT_FIELD, 0xFFFF_FFFF);

        assertDecodeFails(ArmorGeometryError.TRUNCATED_CONTENT, bytes);
    }

    @Test
    void rejectsPieceCountBeyondBuffer()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, PIECE_COUNT_FIELD, 1000);

        ArmorGeometryDecodeException e = assertDecodeFails(ArmorGeometryError.TRUNCATED_CONTENT, bytes);
        assertEquals(PIECE_COUNT_FIELD, e.offset());
    }

    @Test
    void rejectsDuplicatePieceId()
    {
        byte[] bytes = encoder.encode(twoPieces()).bytes();
        int secondPiece = FIRST_PIECE + 32 + 3 * 16;
        putIntLE(bytes, secondPiece, 1);

        ArmorGeometryDecodeException e = assertDecodeFails(ArmorGeometryError.DUPLICATE_PIECE_ID, bytes);
        assertEquals(secondPiece, e.offset());
    }

    @Test
    void rejectsWrongSectionName()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        bytes[bytes.length - SECTION_NAME_LEN] = 'X';

        assertDecodeFails(ArmorGeometryError.INVALID_SECTION_NAME, bytes);
    }

    @Test
    void rejectsWrongSectionNameLength()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, NAME_LENGTH_FIELD, SECTION_NAME_LEN - 1);

        assertDecodeFails(ArmorGeometryError.INVALID_SECTION_NAME, bytes);
    }

    @Test
    void rejectsSectionNameLengthPastEnd()
    {
        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        putIntLE(bytes, NAME_LENGTH_FIELD, SECTION_NAME_LEN + 2);

        ArmorGeometryDecodeException e = assertDecodeFails(ArmorGeometryError.TRUNCATED_CONTENT, bytes);
        assertEquals(bytes.length - SECTION_NAME_LEN, e.offset());
    }

    @Test
    void acceptsSectionNameLengthWithinTrailingBytesWhenNameCheckDisabled()
    {
        DefaultArmorGeometryDecoder lenient = new DefaultArmorGeometryDecoder(
                ArmorGeometryCodecConfig.builder().withVerifySectionName(false).build());

        byte[] bytes = Arrays.copyOf(encoder.encode(singleTriangle()).bytes(), 300);
        putIntLE(bytes, NAME_LENGTH_FIELD, SECTION_NAME_LEN + 2);

        assertEquals(singleTriangle(), lenient.decode(bytes).record());
    }

    @Test
    void toleratesWrongSectionNameWhenCheckDisabled()
    {
        DefaultArmorGeometryDecoder lenient = new DefaultArmorGeometryDecoder(
                ArmorGeometryCodecConfig.builder().withVerifySectionName(false).build());

        byte[] bytes = encoder.encode(singleTriangle()).bytes();
        bytes[bytes.length - SECTION_NAME_LEN] = 'X';

        assertEquals(singleTriangle(), lenient.decode(bytes).record());
    }

    @Test
    void verifiesExpectedHash()
    {
        EncodedArmorGeometry encoded = encoder.encode(hull());
        ArmorContentHash expected = encoded.metadata().hash();

        DecodedArmorGeometry decoded = decoder.decode(encoded.bytes(), expected);
        assertEquals(expected, decoded.metadata().hash());
    }

    @Test
    void rejectsHashMismatch()
    {
        byte[] bytes = encoder.encode(hull()).bytes();

        ArmorGeometryDecodeException e = assertThrows(ArmorGeometryDecodeException.class,
                () -> decoder.decode(bytes, ArmorContentHash.EMPTY));
        assertEquals(ArmorGeometryError.HASH_MISMATCH, e.error());
        assertEquals(-1, e.offset());
    }

    @Test
    void opaqueRegionChangesAlterHashButNotRecord()
    {
        EncodedArmorGeometry encoded = encoder.encode(singleTriangle());
        byte[] bytes = encoded.bytes();
        bytes[CONTENT_START] = 0x00;

        DecodedArmorGeometry decoded = decoder.decode(bytes);
        assertEquals(singleTriangle(), decoded.record());
        assertNotEquals(encoded.metadata().hash(), decoded.metadata().hash());

        assertDecodeFails(ArmorGeometryError.HASH_MISMATCH,
                () -> decoder.decode(bytes, encoded.metadata().hash()));
    }

    private ArmorGeometryDecodeException assertDecodeFails(ArmorGeometryError expected, byte[] bytes)
    {
        return assertDecodeFails(expected, () -> decoder.decode(bytes));
    }

    private static ArmorGeometryDecodeException assertDecodeFails(ArmorGeometryError expected, Executable decode)
    {
        ArmorGeometryDecodeException e = assertThrows(ArmorGeometryDecodeException.class, decode);
        assertEquals(expected, e.error(), e.getMessage());
        return e;
    }
}
