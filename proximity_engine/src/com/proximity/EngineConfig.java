/*
 * Copyright (C) 2024 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.proximity;

import com.proximity.distance.DistanceConfig;
import com.proximity.pairing.PairingProtocol;
import com.proximity.peer.PeerRegistry;
import com.proximity.token.TokenExchangeProtocol;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

import java.time.Duration;

/** Configuration for a {@link ProximityEngine}. */
@AutoValue
public abstract class EngineConfig {

    /** Returns the identifier peers know this device by. */
    public abstract String getLocalPeerId();

    /** Returns the name shown to peers. */
    public abstract String getLocalDisplayName();

    /** Returns the distance estimation and volume mapping configuration. */
    public abstract DistanceConfig getDistanceConfig();

    /**
     * Returns the time after which a peer that is neither paired nor connected is forgotten if it
     * has not been seen.
     */
    public abstract Duration getStaleTimeout();

    /** Returns the interval between stale peer purges. */
    public abstract Duration getPurgeInterval();

    /** Returns the time after which an unanswered pairing request is abandoned. */
    public abstract Duration getPairingTimeout();

    /** Returns the time after which an unacknowledged ranging token is abandoned. */
    public abstract Duration getTokenExchangeTimeout();

    /**
     * Returns the interval between heartbeats broadcast to connected peers. {@link Duration#ZERO}
     * disables heartbeats.
     */
    public abstract Duration getHeartbeatInterval();

    /** Returns a builder with default values for everything but the local identity. */
    public static Builder builder() {
        return new AutoValue_EngineConfig.Builder()
                .setDistanceConfig(DistanceConfig.defaults())
                .setStaleTimeout(PeerRegistry.DEFAULT_STALE_TIMEOUT)
                .setPurgeInterval(Duration.ofSeconds(5))
                .setPairingTimeout(PairingProtocol.DEFAULT_TIMEOUT)
                .setTokenExchangeTimeout(TokenExchangeProtocol.DEFAULT_TIMEOUT)
                .setHeartbeatInterval(Duration.ZERO);
    }

    /** Builder for {@link EngineConfig}. */
    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setLocalPeerId(String localPeerId);

        public abstract Builder setLocalDisplayName(String localDisplayName);

        public abstract Builder setDistanceConfig(DistanceConfig distanceConfig);

        public abstract Builder setStaleTimeout(Duration staleTimeout);

        public abstract Builder setPurgeInterval(Duration purgeInterval);

        public abstract Builder setPairingTimeout(Duration pairingTimeout);

        public abstract Builder setTokenExchangeTimeout(Duration tokenExchangeTimeout);

        public abstract Builder setHeartbeatInterval(Duration heartbeatInterval);

        abstract EngineConfig autoBuild();

        /** Builds and validates the config. */
        public EngineConfig build() {
            EngineConfig config = autoBuild();
            Preconditions.checkArgument(!config.getLocalPeerId().isEmpty(),
                    "Local peer id must not be empty");
            Preconditions.checkArgument(!config.getLocalDisplayName().isEmpty(),
                    "Local display name must not be empty");
            checkPositive(config.getStaleTimeout(), "Stale timeout");
            checkPositive(config.getPurgeInterval(), "Purge interval");
            checkPositive(config.getPairingTimeout(), "Pairing timeout");
            checkPositive(config.getTokenExchangeTimeout(), "Token exchange timeout");
            Preconditions.checkArgument(!config.getHeartbeatInterval().isNegative(),
                    "Heartbeat interval must not be negative");
            return config;
        }

        private static void checkPositive(Duration duration, String name) {
            Preconditions.checkArgument(!duration.isNegative() && !duration.isZero(),
                    "%s must be positive but was %s", name, duration);
        }
    }
}
