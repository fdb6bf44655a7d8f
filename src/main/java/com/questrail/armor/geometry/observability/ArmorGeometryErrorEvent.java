package com.questrail.armor.geometry.observability;

import com.questrail.armor.geometry.codec.ArmorGeometryError;
import com.questrail.armor.geometry.codec.ArmorGeometryException;

import java.time.Instant;

/**
 * Record representing a failed encode or decode.
 */
public record ArmorGeometryErrorEvent(
    Instant timestamp,
    Operation operation,
    ArmorGeometryException cause
) {
    public enum Operation { ENCODE, DECODE }

    public ArmorGeometryError error() {
        return cause.error();
    }

    public String message() {
        return cause.getMessage();
    }
}
