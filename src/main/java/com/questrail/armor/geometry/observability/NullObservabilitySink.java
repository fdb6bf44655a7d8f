package com.questrail.armor.geometry.observability;

/**
 * No-op implementation of ArmorGeometryObservabilitySink.
 */
public final class NullObservabilitySink implements ArmorGeometryObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onEncoded(ArmorGeometryEncodedEvent event) {}

    @Override
    public void onDecoded(ArmorGeometryDecodedEvent event) {}

    @Override
    public void onError(ArmorGeometryErrorEvent event) {}
}
