package com.questrail.armor.geometry;

import com.questrail.armor.api.ArmorContentHash;
import com.questrail.armor.api.ArmorRecord;
import com.questrail.armor.api.PieceId;
import com.questrail.armor.api.Vertex;
import com.questrail.armor.geometry.codec.ArmorGeometryDecodeException;
import com.questrail.armor.geometry.codec.ArmorGeometryError;
import com.questrail.armor.geometry.codec.DecodedArmorGeometry;
import com.questrail.armor.geometry.codec.EncodedArmorGeometry;
import com.questrail.armor.geometry.codec.impl.DefaultArmorGeometryDecoder;
import com.questrail.armor.geometry.codec.impl.DefaultArmorGeometryEncoder;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import static com.questrail.armor.geometry.ArmorFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Semantic round-trip tests.
 *
 * These tests prove:
 *   ArmorRecord -> bytes -> ArmorRecord
 * preserves pieces, order and coordinates bit for bit, and that encode and
 * decode agree on the content metadata.
 */
final class ArmorGeometryEncodeDecodeRoundTripTest
{
    private static final Set<ArmorGeometryError> TRUNCATION_ERRORS =
            EnumSet.of(ArmorGeometryError.MALFORMED_HEADER, ArmorGeometryError.TRUNCATED_CONTENT);

    private final DefaultArmorGeometryEncoder encoder = new DefaultArmorGeometryEncoder();
    private final DefaultArmorGeometryDecoder decoder = new DefaultArmorGeometryDecoder();

    @Test
    void emptyRecordRoundTrip()
    {
        assertRoundTrip(ArmorRecord.empty());
    }

    @Test
    void singleTriangleRoundTrip()
    {
        assertRoundTrip(singleTriangle());
    }

    @Test
    void hullRoundTripPreservesOrderAndEmptyPiece()
    {
        DecodedArmorGeometry decoded = assertRoundTrip(hull());

        assertIterableEquals(
                hull().pieces().keySet(),
                decoded.record().pieces().keySet());
        assertEquals(0, decoded.record().get(PieceId.of(17)).orElseThrow().vertexCount());
    }

    @Test
    void recordWhoseOnlyPieceIsEmptyRoundTrips()
    {
        ArmorRecord record = ArmorRecord.builder().piece(9).build();

        DecodedArmorGeometry decoded = assertRoundTrip(record);
        assertEquals(72, decoded.metadata().size());
        assertNotEquals(ArmorContentHash.EMPTY, decoded.metadata().hash());
    }

    @Test
    void specialFloatValuesRoundTripBitExact()
    {
        ArmorRecord record = ArmorRecord.builder()
                .piece(7, triangle(
                        Float.NaN, -0.0f, Float.POSITIVE_INFINITY,
                        Float.NEGATIVE_INFINITY, Float.MIN_VALUE, Float.MAX_VALUE,
                        0.0f, -Float.MIN_NORMAL, 1.0f / 3.0f))
                .build();

        DecodedArmorGeometry decoded = assertRoundTrip(record);

        Vertex a = decoded.record().get(PieceId.of(7)).orElseThrow().triangles().get(0).a();
        assertTrue(Float.isNaN(a.x()));
        assertEquals(Float.floatToRawIntBits(-0.0f), Float.floatToRawIntBits(a.y()));
    }

    @Test
    void largestEncodableIdRoundTrips()
    {
        ArmorRecord record = ArmorRecord.builder()
                .piece(PieceId.MAX_UNSIGNED_32, triangle(1, 2, 3, 4, 5, 6, 7, 8, 9))
                .piece(0, triangle(9, 8, 7, 6, 5, 4, 3, 2, 1))
                .build();

        assertRoundTrip(record);
    }

    @Test
    void everyTruncationOfEmptyShapeIsRejected()
    {
        assertEveryTruncationRejected(encoder.encode(ArmorRecord.empty()).bytes());
    }

    @Test
    void everyTruncationOfHullIsRejected()
    {
        assertEveryTruncationRejected(encoder.encode(hull()).bytes());
    }

    private DecodedArmorGeometry assertRoundTrip(ArmorRecord original)
    {
        EncodedArmorGeometry encoded = encoder.encode(original);
        DecodedArmorGeometry decoded = decoder.decode(encoded.bytes(), encoded.metadata().hash());

        assertEquals(original, decoded.record());
        assertEquals(encoded.metadata(), decoded.metadata());
        return decoded;
    }

    private void assertEveryTruncationRejected(byte[] full)
    {
        for (int n = 0; n < full.length; n++) {
            byte[] truncated = Arrays.copyOf(full, n);
            ArmorGeometryDecodeException e =
                    assertThrows(ArmorGeometryDecodeException.class, () -> decoder.decode(truncated),
                            "prefix of " + n + " bytes");
            assertTrue(TRUNCATION_ERRORS.contains(e.error()),
                    "prefix of " + n + " bytes failed with " + e.error());
        }
    }
}
