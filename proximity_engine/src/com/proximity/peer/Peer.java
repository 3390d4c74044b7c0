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

package com.proximity.peer;

import com.proximity.distance.DistanceLevel;
import com.proximity.ranging.RangingTechnology;

import com.google.auto.value.AutoValue;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.time.Instant;
import java.util.OptionalInt;

/** Immutable snapshot of everything known about one remote device. */
@AutoValue
public abstract class Peer {

    /** Stable identifier, unique within the registry. */
    public abstract @NonNull String getId();

    public abstract @NonNull String getDisplayName();

    public abstract @NonNull ConnectionState getConnectionState();

    public abstract @NonNull PairingState getPairingState();

    /** Ranging technology that supplied the current distance. */
    public abstract @NonNull RangingTechnology getProviderType();

    /** Smoothed distance in meters, 0 until the first valid sample. */
    public abstract double getDistance();

    public abstract @NonNull DistanceLevel getDistanceLevel();

    /** Listening volume in [0, 1] derived from the distance, 0 until the first valid sample. */
    public abstract double getVolume();

    /** Last signal strength in dBm, if one was observed. */
    public abstract OptionalInt getRawSignalStrength();

    public abstract @NonNull Instant getLastSeen();

    /** Whether the peer runs a compatible application rather than being an unrelated device. */
    public abstract boolean isCompatiblePeer();

    public abstract boolean isSelected();

    /** Whether a precise ranging session is configured with this peer's token. */
    public abstract boolean isPreciseRangingActive();

    /** @return true if the peer belongs to the active set: connected or paired. */
    public boolean isActive() {
        return getConnectionState() == ConnectionState.CONNECTED
                || getPairingState() == PairingState.PAIRED;
    }

    public abstract Builder toBuilder();

    /** @return a builder for a newly seen, unranged and unpaired peer. */
    public static Builder builder(@NonNull String id, @NonNull Instant lastSeen) {
        return new AutoValue_Peer.Builder()
                .setId(id)
                .setDisplayName(id)
                .setConnectionState(ConnectionState.DISCONNECTED)
                .setPairingState(PairingState.NONE)
                .setProviderType(RangingTechnology.SIGNAL_STRENGTH)
                .setDistance(0.0)
                .setDistanceLevel(DistanceLevel.UNKNOWN)
                .setVolume(0.0)
                .setLastSeen(lastSeen)
                .setCompatiblePeer(false)
                .setSelected(false)
                .setPreciseRangingActive(false);
    }

    /** Builder for {@link Peer}. */
    @AutoValue.Builder
    public abstract static class Builder {
        abstract Builder setId(String id);

        public abstract Builder setDisplayName(String displayName);

        public abstract Builder setConnectionState(ConnectionState connectionState);

        public abstract Builder setPairingState(PairingState pairingState);

        public abstract Builder setProviderType(RangingTechnology providerType);

        public abstract Builder setDistance(double distance);

        public abstract Builder setDistanceLevel(DistanceLevel distanceLevel);

        public abstract Builder setVolume(double volume);

        public abstract Builder setRawSignalStrength(int rawSignalStrength);

        public abstract Builder setRawSignalStrength(OptionalInt rawSignalStrength);

        public abstract Builder setLastSeen(Instant lastSeen);

        public abstract Builder setCompatiblePeer(boolean compatiblePeer);

        public abstract Builder setSelected(boolean selected);

        public abstract Builder setPreciseRangingActive(boolean preciseRangingActive);

        public abstract Peer build();
    }
}
