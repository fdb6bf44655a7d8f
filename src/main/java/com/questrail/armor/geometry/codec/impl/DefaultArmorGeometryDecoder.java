package com.questrail.armor.geometry.codec.impl;

import com.questrail.armor.api.ArmorContentHash;
import com.questrail.armor.api.ArmorContentMetadata;
import com.questrail.armor.api.ArmorPiece;
import com.questrail.armor.api.ArmorRecord;
import com.questrail.armor.api.PieceId;
import com.questrail.armor.api.Vertex;
import com.questrail.armor.geometry.codec.ArmorGeometryDecodeException;
import com.questrail.armor.geometry.codec.ArmorGeometryDecoder;
import com.questrail.armor.geometry.codec.ArmorGeometryError;
import com.questrail.armor.geometry.codec.DecodedArmorGeometry;
import com.questrail.armor.geometry.config.ArmorGeometryCodecConfig;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.armor.geometry.codec.impl.ArmorGeometryLayout.*;

/**
 * DefaultArmorGeometryDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ArmorGeometryDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Block count: 0 ends decoding with the empty record, 1 continues</li>
 *   <li>Armor section pointer and section header fields</li>
 *   <li>Content region: pieces and their vertex records</li>
 *   <li>Consistency of the stored length and position fields with the bytes consumed</li>
 *   <li>Section name</li>
 *   <li>Content digest and, if requested, comparison with the expected digest</li>
 * </ol>
 *
 * <p>The stored section pointer is honored; the armor section is not assumed
 * to start at the position the encoder uses. Bytes following the section name
 * are ignored, since real containers carry further data there.</p>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public final class DefaultArmorGeometryDecoder implements ArmorGeometryDecoder
{
    private final boolean verifyZeroSpacers;
    private final boolean verifySectionName;

    public DefaultArmorGeometryDecoder()
    {
        this(ArmorGeometryCodecConfig.defaults());
    }

    public DefaultArmorGeometryDecoder(ArmorGeometryCodecConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.verifyZeroSpacers = config.verifyZeroSpacers();
        this.verifySectionName = config.verifySectionName();
    }

    @Override
    public DecodedArmorGeometry decode(byte[] bytes, Optional<ArmorContentHash> expectedHash)
    {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(expectedHash, "expectedHash");

        final ByteBuf buf = Unpooled.wrappedBuffer(bytes);
        try {
            return decode(buf, bytes, expectedHash);
        } finally {
            buf.release();
        }
    }

    private DecodedArmorGeometry decode(ByteBuf buf, byte[] bytes, Optional<ArmorContentHash> expectedHash)
    {
        // ---------------------------------------------------------------------
        // 1) Block count
        // ---------------------------------------------------------------------

        requireHeader(buf, BLOCK_COUNT_OFFSET, FIELD_LEN, "armor block count");
        final long blockCount = buf.getUnsignedIntLE(BLOCK_COUNT_OFFSET);

        if (blockCount == 0) {
            // The empty shape must be complete, but nothing past it is interpreted.
            requireHeader(buf, ARMOR_SECTION_POS_OFFSET, FIELD_LEN, "armor section position");
            verifyExpectedHash(ArmorContentHash.EMPTY, expectedHash);
            return new DecodedArmorGeometry(ArmorRecord.empty(), ArmorContentMetadata.EMPTY);
        }
        if (blockCount != 1) {
            throw malformed(BLOCK_COUNT_OFFSET, "Unsupported armor block count: " + blockCount);
        }

        // ---------------------------------------------------------------------
        // 2) Section pointer and section header
        // ---------------------------------------------------------------------

        requireHeader(buf, ARMOR_SECTION_POS_OFFSET, 2 * FIELD_LEN, "armor section position");
        final long sectionPosition = buf.getUnsignedIntLE(ARMOR_SECTION_POS_OFFSET);
        expectZeroSpacer(buf, ARMOR_SECTION_POS_OFFSET + FIELD_LEN);

        if (sectionPosition < MIN_SECTION_START || sectionPosition > buf.writerIndex()) {
            throw malformed(ARMOR_SECTION_POS_OFFSET,
                    "Armor section position 0x" + Long.toHexString(sectionPosition)
                            + " outside [0x" + Integer.toHexString(MIN_SECTION_START)
                            + ", 0x" + Integer.toHexString(buf.writerIndex()) + "]");
        }

        final int section = (int) sectionPosition;
        requireHeader(buf, section, SECTION_HEADER_LEN, "armor section header");

        final long contentLength = buf.getUnsignedIntLE(section);
        expectZeroSpacer(buf, section + FIELD_LEN);
        final int nameLengthField = section + NAME_LENGTH_FIELD;
        final long nameLength = buf.getUnsignedIntLE(nameLengthField);
        expectZeroSpacer(buf, nameLengthField + FIELD_LEN);
        final long namePosition = buf.getUnsignedIntLE(section + NAME_POSITION_FIELD);
        expectZeroSpacer(buf, section + NAME_POSITION_FIELD + FIELD_LEN);

        // ---------------------------------------------------------------------
        // 3) Content region
        // ---------------------------------------------------------------------

        final int contentStart = section + SECTION_HEADER_LEN;
        buf.readerIndex(contentStart);
        final ArmorRecord record = readContent(buf);
        final int contentEnd = buf.readerIndex();
        final int derivedLength = contentEnd - contentStart;

        // ---------------------------------------------------------------------
        // 4) Stored length and position must agree with what was consumed
        // ---------------------------------------------------------------------

        if (derivedLength != contentLength) {
            throw new ArmorGeometryDecodeException(ArmorGeometryError.CONTENT_LENGTH_MISMATCH, section,
                    "Stored content length " + contentLength + " but content region spans " + derivedLength
                            + " bytes (misaligned after reading armor section)");
        }
        if (nameLengthField + namePosition != contentEnd) {
            throw new ArmorGeometryDecodeException(ArmorGeometryError.CONTENT_LENGTH_MISMATCH,
                    section + NAME_POSITION_FIELD,
                    "Stored section name position 0x" + Long.toHexString(nameLengthField + namePosition)
                            + " but content region ends at 0x" + Integer.toHexString(contentEnd));
        }

        // ---------------------------------------------------------------------
        // 5) Section name
        // ---------------------------------------------------------------------

        readSectionName(buf, nameLength);

        // ---------------------------------------------------------------------
        // 6) Metadata
        // ---------------------------------------------------------------------

        final ArmorContentHash hash = ArmorContentDigest.digest(bytes, contentStart, derivedLength);
        verifyExpectedHash(hash, expectedHash);

        return new DecodedArmorGeometry(record, new ArmorContentMetadata(derivedLength, hash));
    }

    private static ArmorRecord readContent(ByteBuf buf)
    {
        requireContent(buf, CONTENT_PREAMBLE_LEN + FIELD_LEN, "content preamble and piece count");
        buf.skipBytes(CONTENT_PREAMBLE_LEN);

        final int pieceCountOffset = buf.readerIndex();
        final long pieceCount = buf.readUnsignedIntLE();
        if (pieceCount == 0) {
            // A record without pieces has its own shape (block count 0).
            throw malformed(pieceCountOffset, "Armor block present but declares no pieces");
        }
        if (pieceCount * PIECE_HEADER_LEN > buf.readableBytes()) {
            throw truncated(pieceCountOffset,
                    "Declared " + pieceCount + " armor pieces but only "
                            + buf.readableBytes() + " bytes remain");
        }

        final Map<PieceId, ArmorPiece> pieces = new LinkedHashMap<>();
        for (long i = 0; i < pieceCount; i++) {
            final int pieceStart = buf.readerIndex();
            requireContent(buf, PIECE_HEADER_LEN, "armor piece header");

            final PieceId id = PieceId.of(buf.readUnsignedIntLE());
            buf.skipBytes(PIECE_OPAQUE_LEN);

            final int vertexCountOffset = buf.readerIndex();
            final long vertexCount = buf.readUnsignedIntLE();
            if (vertexCount % 3 != 0) {
                throw new ArmorGeometryDecodeException(ArmorGeometryError.VERTEX_COUNT_NOT_MULTIPLE_OF_THREE,
                        vertexCountOffset,
                        "Armor piece " + id.value() + " declares " + vertexCount
                                + " vertices, which cannot be grouped into triangles");
            }
            if (vertexCount * VERTEX_RECORD_LEN > buf.readableBytes()) {
                throw truncated(vertexCountOffset,
                        "Armor piece " + id.value() + " declares " + vertexCount
                                + " vertices but only " + buf.readableBytes() + " bytes remain");
            }

            final List<Vertex> vertices = new ArrayList<>((int) vertexCount);
            for (long v = 0; v < vertexCount; v++) {
                final float x = buf.readFloatLE();
                final float y = buf.readFloatLE();
                final float z = buf.readFloatLE();
                buf.skipBytes(VERTEX_OPAQUE_LEN);
                vertices.add(new Vertex(x, y, z));
            }

            if (pieces.containsKey(id)) {
                throw new ArmorGeometryDecodeException(ArmorGeometryError.DUPLICATE_PIECE_ID, pieceStart,
                        "Armor piece id " + id.value() + " occurs more than once");
            }
            pieces.put(id, ArmorPiece.fromVertices(vertices));
        }
        return ArmorRecord.of(pieces);
    }

    private void readSectionName(ByteBuf buf, long nameLength)
    {
        final int nameStart = buf.readerIndex();
        if (nameLength > buf.readableBytes()) {
            throw truncated(nameStart,
                    "Section name of " + nameLength + " bytes runs past end of buffer ("
                            + buf.readableBytes() + " bytes remain)");
        }
        if (!verifySectionName) {
            return;
        }

        final byte[] expected = sectionName();
        if (nameLength != expected.length) {
            throw invalidName(nameStart, "Section name length " + nameLength + ", expected " + expected.length);
        }
        final byte[] actual = new byte[expected.length];
        buf.readBytes(actual);
        if (!Arrays.equals(expected, actual)) {
            throw invalidName(nameStart, "Unexpected section name '" + printable(actual) + "'");
        }
    }

    private void expectZeroSpacer(ByteBuf buf, int offset)
    {
        if (verifyZeroSpacers && buf.getIntLE(offset) != 0) {
            throw malformed(offset, "Expected 4 zero bytes at 0x" + Integer.toHexString(offset)
                    + " but found 0x" + Integer.toHexString(buf.getIntLE(offset)));
        }
    }

    private static void verifyExpectedHash(ArmorContentHash actual, Optional<ArmorContentHash> expectedHash)
    {
        if (expectedHash.isPresent() && !expectedHash.get().equals(actual)) {
            throw new ArmorGeometryDecodeException(ArmorGeometryError.HASH_MISMATCH, -1,
                    "Content hash " + actual.toHex() + " does not match expected " + expectedHash.get().toHex());
        }
    }

    /**
     * Fixed-size header fields must lie entirely within the buffer.
     */
    private static void requireHeader(ByteBuf buf, int offset, int length, String what)
    {
        if ((long) offset + length > buf.writerIndex()) {
            throw malformed(offset, "Buffer of " + buf.writerIndex() + " bytes ends before " + what
                    + " at 0x" + Integer.toHexString(offset));
        }
    }

    private static void requireContent(ByteBuf buf, int length, String what)
    {
        if (buf.readableBytes() < length) {
            throw truncated(buf.readerIndex(), "Buffer ends before " + what
                    + " (" + length + " bytes needed, " + buf.readableBytes() + " remain)");
        }
    }

    private static String printable(byte[] name)
    {
        final StringBuilder sb = new StringBuilder(name.length);
        for (byte b : name) {
            final int c = b & 0xFF;
            if (c >= 0x20 && c < 0x7F) {
                sb.append((char) c);
            } else {
                sb.append(String.format("\\x%02x", c));
            }
        }
        return sb.toString();
    }

    private static ArmorGeometryDecodeException malformed(long offset, String message)
    {
        return new ArmorGeometryDecodeException(ArmorGeometryError.MALFORMED_HEADER, offset, message);
    }

    private static ArmorGeometryDecodeException truncated(long offset, String message)
    {
        return new ArmorGeometryDecodeException(ArmorGeometryError.TRUNCATED_CONTENT, offset, message);
    }

    private static ArmorGeometryDecodeException invalidName(long offset, String message)
    {
        return new ArmorGeometryDecodeException(ArmorGeometryError.INVALID_SECTION_NAME, offset, message);
    }
}
