package com.questrail.armor.geometry;

import com.questrail.armor.api.ArmorContentHash;
import com.questrail.armor.api.ArmorRecord;
import com.questrail.armor.geometry.codec.ArmorGeometryDecodeException;
import com.questrail.armor.geometry.codec.ArmorGeometryDecoder;
import com.questrail.armor.geometry.codec.ArmorGeometryEncodeException;
import com.questrail.armor.geometry.codec.ArmorGeometryEncoder;
import com.questrail.armor.geometry.codec.DecodedArmorGeometry;
import com.questrail.armor.geometry.codec.EncodedArmorGeometry;
import com.questrail.armor.geometry.codec.impl.DefaultArmorGeometryDecoder;
import com.questrail.armor.geometry.codec.impl.DefaultArmorGeometryEncoder;
import com.questrail.armor.geometry.config.ArmorGeometryCodecConfig;
import com.questrail.armor.geometry.observability.ArmorGeometryDecodedEvent;
import com.questrail.armor.geometry.observability.ArmorGeometryEncodedEvent;
import com.questrail.armor.geometry.observability.ArmorGeometryErrorEvent;
import com.questrail.armor.geometry.observability.ArmorGeometryObservabilitySink;

import java.util.Objects;
import java.util.Optional;

/**
 * ArmorGeometryCodec
 * -----------------------------------------------------------------------------
 * Entry point for converting between {@link ArmorRecord} and geometry
 * container bytes.
 *
 * <h2>What this class is</h2>
 * <ul>
 *   <li>The composition point for a configured encoder and decoder</li>
 *   <li>The place where outcomes are reported to the observability sink</li>
 * </ul>
 *
 * <h2>What this class is <em>not</em></h2>
 * <ul>
 *   <li>It does <strong>not</strong> read or write files</li>
 *   <li>It does <strong>not</strong> parse external armor documents</li>
 *   <li>It does <strong>not</strong> reinterpret encoder or decoder results</li>
 * </ul>
 *
 * <p>Failures are reported to the sink and then rethrown unchanged.
 * Instances hold no mutable state and may be shared between threads, provided
 * the configured sink is thread-safe.</p>
 */
public final class ArmorGeometryCodec
{
    private final ArmorGeometryEncoder encoder;
    private final ArmorGeometryDecoder decoder;
    private final ArmorGeometryCodecConfig config;

    public ArmorGeometryCodec()
    {
        this(ArmorGeometryCodecConfig.defaults());
    }

    public ArmorGeometryCodec(ArmorGeometryCodecConfig config)
    {
        this(config, new DefaultArmorGeometryEncoder(), new DefaultArmorGeometryDecoder(config));
    }

    public ArmorGeometryCodec(ArmorGeometryCodecConfig config,
                              ArmorGeometryEncoder encoder,
                              ArmorGeometryDecoder decoder)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * Encode a record into container bytes plus content metadata.
     *
     * @throws ArmorGeometryEncodeException if the record cannot be represented on the wire
     */
    public EncodedArmorGeometry encode(ArmorRecord record)
    {
        Objects.requireNonNull(record, "record");

        final EncodedArmorGeometry encoded;
        try {
            encoded = encoder.encode(record);
        } catch (ArmorGeometryEncodeException e) {
            sink().onError(new ArmorGeometryErrorEvent(config.wallClock().now(),
                    ArmorGeometryErrorEvent.Operation.ENCODE, e));
            throw e;
        }

        sink().onEncoded(new ArmorGeometryEncodedEvent(
                config.wallClock().now(),
                record.size(),
                record.vertexCount(),
                encoded.length(),
                encoded.metadata()));
        return encoded;
    }

    /**
     * Decode container bytes without digest verification.
     *
     * @throws ArmorGeometryDecodeException if the buffer is malformed
     */
    public DecodedArmorGeometry decode(byte[] bytes)
    {
        return decode(bytes, Optional.empty());
    }

    /**
     * Decode container bytes and require the content digest to equal
     * {@code expectedHash}.
     *
     * @throws ArmorGeometryDecodeException if the buffer is malformed or the digest differs
     */
    public DecodedArmorGeometry decode(byte[] bytes, ArmorContentHash expectedHash)
    {
        return decode(bytes, Optional.of(Objects.requireNonNull(expectedHash, "expectedHash")));
    }

    private DecodedArmorGeometry decode(byte[] bytes, Optional<ArmorContentHash> expectedHash)
    {
        Objects.requireNonNull(bytes, "bytes");

        final DecodedArmorGeometry decoded;
        try {
            decoded = decoder.decode(bytes, expectedHash);
        } catch (ArmorGeometryDecodeException e) {
            sink().onError(new ArmorGeometryErrorEvent(config.wallClock().now(),
                    ArmorGeometryErrorEvent.Operation.DECODE, e));
            throw e;
        }

        sink().onDecoded(new ArmorGeometryDecodedEvent(
                config.wallClock().now(),
                decoded.record().size(),
                decoded.record().vertexCount(),
                bytes.length,
                decoded.metadata(),
                expectedHash.isPresent()));
        return decoded;
    }

    public ArmorGeometryCodecConfig config()
    {
        return config;
    }

    private ArmorGeometryObservabilitySink sink()
    {
        return config.observabilitySink();
    }
}
