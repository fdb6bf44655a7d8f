package com.questrail.armor.geometry.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp observability events.
 *
 * <p>
 * The codec itself is time-independent; encoding and decoding never consult
 * this clock. Tests substitute a fixed instant.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
