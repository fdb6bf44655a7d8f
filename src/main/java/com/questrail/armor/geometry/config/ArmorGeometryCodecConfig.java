package com.questrail.armor.geometry.config;

import com.questrail.armor.geometry.internal.time.SystemWallClock;
import com.questrail.armor.geometry.internal.time.WallClock;
import com.questrail.armor.geometry.observability.ArmorGeometryObservabilitySink;
import com.questrail.armor.geometry.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for the armor geometry codec.
 *
 * <ul>
 *   <li>{@code verifyZeroSpacers}: reject buffers whose spacer fields after the
 *       section pointer and section header fields are not zero</li>
 *   <li>{@code verifySectionName}: reject buffers whose trailing section name is
 *       not the expected armor section name</li>
 *   <li>{@code observabilitySink}: receives encode, decode and error events</li>
 *   <li>{@code wallClock}: timestamps those events</li>
 * </ul>
 */
public record ArmorGeometryCodecConfig(
    boolean verifyZeroSpacers,
    boolean verifySectionName,
    ArmorGeometryObservabilitySink observabilitySink,
    WallClock wallClock
) {
    public ArmorGeometryCodecConfig {
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    public static ArmorGeometryCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean verifyZeroSpacers = true;
        private boolean verifySectionName = true;
        private ArmorGeometryObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withVerifyZeroSpacers(boolean verifyZeroSpacers) {
            this.verifyZeroSpacers = verifyZeroSpacers;
            return this;
        }

        public Builder withVerifySectionName(boolean verifySectionName) {
            this.verifySectionName = verifySectionName;
            return this;
        }

        public Builder withObservabilitySink(ArmorGeometryObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public ArmorGeometryCodecConfig build() {
            return new ArmorGeometryCodecConfig(verifyZeroSpacers, verifySectionName, observabilitySink, wallClock);
        }
    }
}
