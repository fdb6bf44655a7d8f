package com.questrail.armor.geometry.codec.impl;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * ArmorGeometryLayout
 * -----------------------------------------------------------------------------
 * Fixed structural values of the geometry container, as far as the armor
 * section is concerned.
 *
 * <p>The meaning of the regions written as {@link #FILL} is unknown. They are
 * reproduced byte-exact when encoding and skipped, never interpreted, when
 * decoding. In real containers the space between the header and the armor
 * section holds vertex, index and collision model data; that data is outside
 * the scope of this codec and is likewise treated as opaque.</p>
 */
final class ArmorGeometryLayout
{
    /** Sentinel byte for opaque regions. */
    static final int FILL = 0xFF;

    /** Leading fill bytes before the block count. */
    static final int HEADER_FILL_LEN = 20;

    /** Position of the armor block count (u32 LE). */
    static final int BLOCK_COUNT_OFFSET = 20;

    /** Position of the armor section pointer (u32 LE), followed by a zero spacer. */
    static final int ARMOR_SECTION_POS_OFFSET = 0x40;

    /** Where the encoder places the armor section. Decoding follows the stored pointer. */
    static final int ARMOR_SECTION_START = 0x60;

    /** Size of a u32 field and of each zero spacer. */
    static final int FIELD_LEN = 4;

    /** Length of the "no armor block" container. */
    static final int EMPTY_LENGTH = ARMOR_SECTION_POS_OFFSET + FIELD_LEN;

    /** First byte that may belong to an armor section (after pointer and spacer). */
    static final int MIN_SECTION_START = ARMOR_SECTION_POS_OFFSET + 2 * FIELD_LEN;

    /** contentLength, nameLength and namePosition, each followed by a zero spacer. */
    static final int SECTION_HEADER_LEN = 6 * FIELD_LEN;

    /** Offset of the section name length field within the armor section. */
    static final int NAME_LENGTH_FIELD = 2 * FIELD_LEN;

    /** Offset of the section name position field within the armor section. */
    static final int NAME_POSITION_FIELD = 4 * FIELD_LEN;

    /** Opaque region at the start of the content region. */
    static final int CONTENT_PREAMBLE_LEN = 36;

    /** Opaque region after each piece id. */
    static final int PIECE_OPAQUE_LEN = 24;

    /** id, opaque region, vertex count. */
    static final int PIECE_HEADER_LEN = FIELD_LEN + PIECE_OPAQUE_LEN + FIELD_LEN;

    /** Opaque region after each vertex. */
    static final int VERTEX_OPAQUE_LEN = 4;

    /** x, y, z as f32 plus the opaque region. */
    static final int VERTEX_RECORD_LEN = 3 * Float.BYTES + VERTEX_OPAQUE_LEN;

    private static final byte[] SECTION_NAME =
            "CM_PA_united.armor\u0000".getBytes(StandardCharsets.US_ASCII);

    /** Length of the section name including its NUL terminator (19). */
    static final int SECTION_NAME_LEN = SECTION_NAME.length;

    private ArmorGeometryLayout() {}

    /**
     * Returns a copy of the section name bytes, NUL terminator included.
     */
    static byte[] sectionName()
    {
        return SECTION_NAME.clone();
    }

    /**
     * Exact length of a content region holding the given number of pieces and
     * vertices.
     */
    static long contentLength(long pieceCount, long vertexCount)
    {
        return CONTENT_PREAMBLE_LEN
                + FIELD_LEN
                + pieceCount * PIECE_HEADER_LEN
                + vertexCount * VERTEX_RECORD_LEN;
    }

    /**
     * Appends {@code count} fill bytes.
     */
    static void writeFill(ByteBuf buf, int count)
    {
        buf.ensureWritable(count);
        for (int i = 0; i < count; i++) {
            buf.writeByte(FILL);
        }
    }

    /**
     * Appends fill bytes until the writer index reaches {@code position}.
     */
    static void fillTo(ByteBuf buf, int position)
    {
        final int gap = position - buf.writerIndex();
        if (gap < 0) {
            throw new IllegalStateException(
                    "Writer already past 0x" + Integer.toHexString(position)
                            + " (at 0x" + Integer.toHexString(buf.writerIndex()) + ")");
        }
        writeFill(buf, gap);
    }
}
