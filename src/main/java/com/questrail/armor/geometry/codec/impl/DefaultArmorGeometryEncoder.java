package com.questrail.armor.geometry.codec.impl;

import com.questrail.armor.api.ArmorContentHash;
import com.questrail.armor.api.ArmorContentMetadata;
import com.questrail.armor.api.ArmorPiece;
import com.questrail.armor.api.ArmorRecord;
import com.questrail.armor.api.PieceId;
import com.questrail.armor.api.Vertex;
import com.questrail.armor.geometry.codec.ArmorGeometryEncodeException;
import com.questrail.armor.geometry.codec.ArmorGeometryEncoder;
import com.questrail.armor.geometry.codec.ArmorGeometryError;
import com.questrail.armor.geometry.codec.EncodedArmorGeometry;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.Map;
import java.util.Objects;

import static com.questrail.armor.geometry.codec.impl.ArmorGeometryLayout.*;

/**
 * DefaultArmorGeometryEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ArmorGeometryEncoder}.
 *
 * <p>This encoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Validate that every piece id fits the wire field</li>
 *   <li>Build the content region in its own buffer</li>
 *   <li>Derive content length, section name position and digest from it</li>
 *   <li>Assemble header, padding, section header, content and section name</li>
 * </ol>
 *
 * <p>Because the content region is complete before the section header is
 * written, the length and position fields are emitted with their final
 * values; nothing is written twice.</p>
 *
 * <p>Instances are stateless and may be shared between threads.</p>
 */
public final class DefaultArmorGeometryEncoder implements ArmorGeometryEncoder
{
    /** Largest array size the JVM reliably allocates. */
    private static final long MAX_BUFFER_LEN = Integer.MAX_VALUE - 8;

    @Override
    public EncodedArmorGeometry encode(ArmorRecord record)
    {
        Objects.requireNonNull(record, "record");

        if (record.isEmpty()) {
            return encodeEmpty();
        }

        requireEncodableIds(record);

        final long contentLength = contentLength(record.size(), record.vertexCount());
        final long totalLength = ARMOR_SECTION_START + SECTION_HEADER_LEN + contentLength + SECTION_NAME_LEN;
        if (totalLength > MAX_BUFFER_LEN) {
            throw new ArmorGeometryEncodeException(ArmorGeometryError.CONTENT_TOO_LARGE,
                    "Encoded armor geometry would need " + totalLength + " bytes");
        }

        // ---------------------------------------------------------------------
        // 1) Content region, buffered on its own so it can be measured and hashed
        // ---------------------------------------------------------------------

        final byte[] content = writeContent(record, (int) contentLength);
        final ArmorContentHash hash = ArmorContentDigest.digest(content);

        // ---------------------------------------------------------------------
        // 2) Container: header, armor section header, content, section name
        // ---------------------------------------------------------------------

        final ByteBuf out = Unpooled.buffer((int) totalLength);
        try {
            writeContainerHeader(out, 1, ARMOR_SECTION_START);
            fillTo(out, ARMOR_SECTION_START);

            final int nameLengthField = out.writerIndex() + NAME_LENGTH_FIELD;
            final int contentOffset = out.writerIndex() + SECTION_HEADER_LEN;
            final int sectionNamePosition = contentOffset + content.length;

            out.writeIntLE(content.length);
            out.writeZero(FIELD_LEN);
            out.writeIntLE(SECTION_NAME_LEN);
            out.writeZero(FIELD_LEN);
            // Stored relative to the section name length field.
            out.writeIntLE(sectionNamePosition - nameLengthField);
            out.writeZero(FIELD_LEN);

            out.writeBytes(content);
            out.writeBytes(sectionName());

            return new EncodedArmorGeometry(
                    ByteBufUtil.getBytes(out),
                    new ArmorContentMetadata(content.length, hash),
                    contentOffset);
        } finally {
            out.release();
        }
    }

    /**
     * The "no armor block" shape: header with a block count of zero and a
     * null section pointer. No content region and no section name follow.
     */
    private static EncodedArmorGeometry encodeEmpty()
    {
        final ByteBuf out = Unpooled.buffer(EMPTY_LENGTH);
        try {
            writeContainerHeader(out, 0, 0);
            return new EncodedArmorGeometry(ByteBufUtil.getBytes(out), ArmorContentMetadata.EMPTY, 0);
        } finally {
            out.release();
        }
    }

    /**
     * Writes fill, block count, fill up to the pointer, and the pointer itself.
     * The zero spacer after the pointer belongs to the non-empty shape only.
     */
    private static void writeContainerHeader(ByteBuf out, int blockCount, int sectionPosition)
    {
        writeFill(out, HEADER_FILL_LEN);
        out.writeIntLE(blockCount);
        fillTo(out, ARMOR_SECTION_POS_OFFSET);
        out.writeIntLE(sectionPosition);
        if (blockCount != 0) {
            out.writeZero(FIELD_LEN);
        }
    }

    private static byte[] writeContent(ArmorRecord record, int contentLength)
    {
        final ByteBuf content = Unpooled.buffer(contentLength);
        try {
            writeFill(content, CONTENT_PREAMBLE_LEN);
            content.writeIntLE(record.size());

            for (Map.Entry<PieceId, ArmorPiece> entry : record.pieces().entrySet()) {
                final ArmorPiece piece = entry.getValue();

                // Unsigned value already range-checked; the cast keeps the low 32 bits.
                content.writeIntLE((int) entry.getKey().value());
                writeFill(content, PIECE_OPAQUE_LEN);
                content.writeIntLE(piece.vertexCount());

                for (Vertex v : piece.vertices()) {
                    content.writeFloatLE(v.x());
                    content.writeFloatLE(v.y());
                    content.writeFloatLE(v.z());
                    writeFill(content, VERTEX_OPAQUE_LEN);
                }
            }
            return ByteBufUtil.getBytes(content);
        } finally {
            content.release();
        }
    }

    private static void requireEncodableIds(ArmorRecord record)
    {
        for (PieceId id : record.pieces().keySet()) {
            if (!id.fitsUnsigned32()) {
                throw new ArmorGeometryEncodeException(ArmorGeometryError.ID_OVERFLOW,
                        "Armor piece id " + id.value() + " exceeds the unsigned 32-bit range");
            }
        }
    }
}
