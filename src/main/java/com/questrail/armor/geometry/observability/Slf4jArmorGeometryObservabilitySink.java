package com.questrail.armor.geometry.observability;

import com.questrail.armor.geometry.codec.ArmorGeometryDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ArmorGeometryObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jArmorGeometryObservabilitySink implements ArmorGeometryObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jArmorGeometryObservabilitySink.class);

    @Override
    public void onEncoded(ArmorGeometryEncodedEvent event) {
        log.debug("Encoded armor geometry: {} pieces, {} vertices, {} bytes, content size {}, hash {}",
            event.pieceCount(),
            event.vertexCount(),
            event.length(),
            event.metadata().size(),
            event.metadata().hash().toHex());
    }

    @Override
    public void onDecoded(ArmorGeometryDecodedEvent event) {
        log.debug("Decoded armor geometry: {} pieces, {} vertices from {} bytes, content size {}, hash {}{}",
            event.pieceCount(),
            event.vertexCount(),
            event.length(),
            event.metadata().size(),
            event.metadata().hash().toHex(),
            event.hashVerified() ? " (verified)" : "");
    }

    @Override
    public void onError(ArmorGeometryErrorEvent event) {
        if (event.cause() instanceof ArmorGeometryDecodeException decode && decode.offset() >= 0) {
            log.warn("Armor geometry {} failed [{}] at offset 0x{}: {}",
                event.operation(),
                event.error(),
                Long.toHexString(decode.offset()),
                event.message());
        } else {
            log.warn("Armor geometry {} failed [{}]: {}",
                event.operation(),
                event.error(),
                event.message());
        }
    }
}
