package com.questrail.armor.geometry.observability;

/**
 * Main interface for receiving armor geometry codec events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are invoked synchronously on the thread performing the encode or
 * decode and must not throw.</p>
 */
public interface ArmorGeometryObservabilitySink {
    /**
     * Called after a record has been encoded.
     * @param event the encode outcome
     */
    void onEncoded(ArmorGeometryEncodedEvent event);

    /**
     * Called after a buffer has been decoded (and verified, if requested).
     * @param event the decode outcome
     */
    void onDecoded(ArmorGeometryDecodedEvent event);

    /**
     * Called when encoding or decoding fails. The failure is rethrown to the
     * caller after this returns.
     * @param event the error event
     */
    void onError(ArmorGeometryErrorEvent event);
}
