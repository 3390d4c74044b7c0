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

import com.proximity.distance.DistanceEstimator;
import com.proximity.distance.DistanceLevel;
import com.proximity.ranging.RangingData;
import com.proximity.ranging.RangingTechnology;
import com.proximity.ranging.fusion.DataFuser;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Single owner of every {@link Peer} record. A peer is either active (connected or paired) or
 * discoverable, never both, because all records live in one map keyed by id.
 *
 * <p>Not thread safe. Confined to the engine's executor.
 */
public class PeerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(PeerRegistry.class);

    public static final Duration DEFAULT_STALE_TIMEOUT = Duration.ofSeconds(30);

    /** Notified of every change to the registry. */
    public interface Listener {
        void onPeerUpdated(@NonNull Peer peer);

        void onPeerRemoved(@NonNull String peerId);
    }

    private final DistanceEstimator mEstimator;
    private final DataFuser mFuser;
    private final Clock mClock;
    private final Duration mStaleTimeout;
    private final Listener mListener;

    /** Insertion ordered, so the first connected entry is the primary active peer. */
    private final Map<String, Peer> mPeers = new LinkedHashMap<>();

    public PeerRegistry(
            @NonNull DistanceEstimator estimator,
            @NonNull DataFuser fuser,
            @NonNull Clock clock,
            @NonNull Duration staleTimeout,
            @NonNull Listener listener
    ) {
        Preconditions.checkArgument(!staleTimeout.isNegative() && !staleTimeout.isZero(),
                "Stale timeout must be positive");
        mEstimator = estimator;
        mFuser = fuser;
        mClock = clock;
        mStaleTimeout = staleTimeout;
        mListener = listener;
    }

    /**
     * Create or refresh a peer seen by discovery. Discovery never changes the connection state of
     * a known peer. A signal strength reading is ranged like any other signal strength sample.
     */
    @CanIgnoreReturnValue
    public @NonNull Peer upsertDiscovered(
            @NonNull String peerId, @NonNull String displayName, @Nullable Integer rssi) {
        Instant now = mClock.instant();
        Peer existing = mPeers.get(peerId);
        Peer.Builder builder;
        if (existing == null) {
            LOG.info("Discovered {} ({})", peerId, displayName);
            builder = Peer.builder(peerId, now).setDisplayName(displayName);
        } else {
            builder = existing.toBuilder().setLastSeen(now);
            if (existing.getConnectionState() != ConnectionState.CONNECTED) {
                builder.setDisplayName(displayName);
            }
        }
        if (rssi != null) {
            builder.setRawSignalStrength(rssi);
        }
        Peer peer = put(builder.build());

        if (rssi != null) {
            applyRangingData(new RangingData.Builder()
                    .setTechnology(RangingTechnology.SIGNAL_STRENGTH)
                    .setPeerId(peerId)
                    .setRssi(rssi)
                    .setTimestamp(now)
                    .build());
            peer = mPeers.get(peerId);
        }
        return peer;
    }

    /** Record that a link to the peer is being established, creating the peer if needed. */
    @CanIgnoreReturnValue
    public @NonNull Peer markConnecting(@NonNull String peerId) {
        return setConnectionState(peerId, ConnectionState.CONNECTING);
    }

    /** Record that the peer is connected, creating the peer if needed. */
    @CanIgnoreReturnValue
    public @NonNull Peer markConnected(@NonNull String peerId) {
        return setConnectionState(peerId, ConnectionState.CONNECTED);
    }

    /**
     * Record that the link to the peer is gone. A paired peer keeps its record with its runtime
     * fields reset; any other peer leaves the registry.
     *
     * @return the retained paired peer, or empty if the peer was removed or unknown.
     */
    @CanIgnoreReturnValue
    public Optional<Peer> markDisconnected(@NonNull String peerId) {
        Peer existing = mPeers.get(peerId);
        if (existing == null) {
            LOG.warn("Disconnect from unknown peer {}", peerId);
            return Optional.empty();
        }
        mEstimator.forget(peerId);
        if (existing.getPairingState() != PairingState.PAIRED) {
            LOG.info("{} disconnected, removing", peerId);
            removeInternal(peerId);
            return Optional.empty();
        }
        LOG.info("Paired peer {} disconnected", peerId);
        return Optional.of(put(existing.toBuilder()
                .setConnectionState(ConnectionState.DISCONNECTED)
                .setDistance(0.0)
                .setDistanceLevel(DistanceLevel.UNKNOWN)
                .setVolume(0.0)
                .setPreciseRangingActive(false)
                .build()));
    }

    /**
     * Attribute ranging data to a peer and apply it if the peer's fuser keeps it. Data without a
     * peer id is attributed to the primary active peer.
     *
     * @return the updated peer, or empty if the data was dropped.
     */
    @CanIgnoreReturnValue
    public Optional<Peer> applyRangingData(@NonNull RangingData data) {
        Optional<String> peerId = data.getPeerId();
        if (peerId.isEmpty()) {
            peerId = primaryActivePeer().map(Peer::getId);
        }
        if (peerId.isEmpty()) {
            LOG.debug("Dropping unattributed {} with no active peer", data);
            return Optional.empty();
        }
        Peer peer = mPeers.get(peerId.get());
        if (peer == null) {
            LOG.debug("Dropping {} for unknown peer", data);
            return Optional.empty();
        }
        Set<RangingTechnology> sources = peer.isPreciseRangingActive()
                ? EnumSet.of(RangingTechnology.PRECISE, RangingTechnology.SIGNAL_STRENGTH)
                : EnumSet.of(RangingTechnology.SIGNAL_STRENGTH);
        Optional<RangingData> fused = mFuser.fuse(data, sources);
        if (fused.isEmpty()) {
            return Optional.empty();
        }
        return applyDistanceUpdate(
                peer.getId(), fused.get().getRawValue(), fused.get().getTechnology());
    }

    /**
     * Smooth a raw measurement and write the resulting distance, tier and volume to the peer.
     * Switching source restarts smoothing so samples from different sources never mix.
     *
     * @param raw dBm for {@link RangingTechnology#SIGNAL_STRENGTH}, meters for
     *            {@link RangingTechnology#PRECISE}.
     * @return the updated peer, or empty if the peer is unknown or the sample invalid.
     */
    @CanIgnoreReturnValue
    public Optional<Peer> applyDistanceUpdate(
            @NonNull String peerId, double raw, @NonNull RangingTechnology source) {
        Peer existing = mPeers.get(peerId);
        if (existing == null) {
            LOG.debug("Distance update for unknown peer {}", peerId);
            return Optional.empty();
        }
        Peer.Builder builder = existing.toBuilder().setLastSeen(mClock.instant());

        double distance;
        if (source == RangingTechnology.SIGNAL_STRENGTH) {
            int rssi = (int) Math.round(raw);
            builder.setRawSignalStrength(rssi);
            if (rssi >= 0) {
                LOG.debug("Ignoring invalid signal strength {} from {}", rssi, peerId);
                return Optional.of(put(builder.build()));
            }
            distance = mEstimator.rssiToDistance(rssi);
        } else {
            distance = raw;
            if (Double.isNaN(distance) || distance < 0) {
                LOG.debug("Ignoring invalid range {} from {}", raw, peerId);
                return Optional.of(put(builder.build()));
            }
        }

        if (existing.getProviderType() != source) {
            LOG.info("{} now ranged by {}", peerId, source);
            mEstimator.forget(peerId);
        }
        double smoothed = mEstimator.addSample(peerId, distance);
        return Optional.of(put(builder
                .setProviderType(source)
                .setDistance(smoothed)
                .setDistanceLevel(mEstimator.distanceLevel(smoothed))
                .setVolume(mEstimator.volumeForDistance(smoothed))
                .build()));
    }

    /**
     * Remove peers not seen within the stale timeout. Paired and connected peers are exempt.
     *
     * @return ids of the removed peers.
     */
    @CanIgnoreReturnValue
    public ImmutableList<String> purgeStale(@NonNull Instant now) {
        List<String> removed = new ArrayList<>();
        Iterator<Peer> iterator = mPeers.values().iterator();
        while (iterator.hasNext()) {
            Peer peer = iterator.next();
            if (peer.getPairingState() == PairingState.PAIRED
                    || peer.getConnectionState() == ConnectionState.CONNECTED) {
                continue;
            }
            if (Duration.between(peer.getLastSeen(), now).compareTo(mStaleTimeout) > 0) {
                iterator.remove();
                mEstimator.forget(peer.getId());
                removed.add(peer.getId());
            }
        }
        for (String peerId : removed) {
            LOG.info("Purged stale peer {}", peerId);
            mListener.onPeerRemoved(peerId);
        }
        return ImmutableList.copyOf(removed);
    }

    /**
     * Toggle selection of a peer. Selecting a peer clears the selection of every other peer.
     *
     * @return the target peer after the toggle, or empty if unknown.
     */
    @CanIgnoreReturnValue
    public Optional<Peer> select(@NonNull String peerId) {
        Peer target = mPeers.get(peerId);
        if (target == null) {
            return Optional.empty();
        }
        boolean select = !target.isSelected();
        if (select) {
            for (Peer peer : ImmutableList.copyOf(mPeers.values())) {
                if (peer.isSelected()) {
                    put(peer.toBuilder().setSelected(false).build());
                }
            }
        }
        return Optional.of(put(target.toBuilder().setSelected(select).build()));
    }

    /** Restore a paired peer from persistent storage. */
    @CanIgnoreReturnValue
    public @NonNull Peer rehydrate(@NonNull String peerId, @NonNull String displayName) {
        Peer existing = mPeers.get(peerId);
        Peer.Builder builder = existing == null
                ? Peer.builder(peerId, mClock.instant())
                        .setDisplayName(displayName)
                        .setCompatiblePeer(true)
                : existing.toBuilder();
        return put(builder.setPairingState(PairingState.PAIRED).build());
    }

    /** @return the updated peer, or empty if unknown. */
    @CanIgnoreReturnValue
    public Optional<Peer> setPairingState(@NonNull String peerId, @NonNull PairingState state) {
        Peer existing = mPeers.get(peerId);
        if (existing == null) {
            return Optional.empty();
        }
        if (existing.getPairingState() == state) {
            return Optional.of(existing);
        }
        LOG.info("{} pairing {} -> {}", peerId, existing.getPairingState(), state);
        Peer updated = existing.toBuilder().setPairingState(state).build();
        if (existing.isActive() && !updated.isActive()) {
            mEstimator.forget(peerId);
        }
        return Optional.of(put(updated));
    }

    /**
     * Apply the contents of a device info message.
     *
     * @return the updated peer, or empty if unknown.
     */
    @CanIgnoreReturnValue
    public Optional<Peer> updateDeviceInfo(
            @NonNull String peerId, @Nullable String displayName, @Nullable Boolean compatible) {
        Peer existing = mPeers.get(peerId);
        if (existing == null) {
            return Optional.empty();
        }
        Peer.Builder builder = existing.toBuilder().setLastSeen(mClock.instant());
        if (displayName != null && !displayName.isEmpty()) {
            builder.setDisplayName(displayName);
        }
        if (compatible != null) {
            builder.setCompatiblePeer(compatible);
        }
        return Optional.of(put(builder.build()));
    }

    /** @return the updated peer, or empty if unknown. */
    @CanIgnoreReturnValue
    public Optional<Peer> setCompatible(@NonNull String peerId, boolean compatible) {
        return update(peerId, peer -> peer.toBuilder().setCompatiblePeer(compatible).build());
    }

    /** @return the updated peer, or empty if unknown. */
    @CanIgnoreReturnValue
    public Optional<Peer> setPreciseRangingActive(@NonNull String peerId, boolean active) {
        return update(peerId, peer -> peer.toBuilder().setPreciseRangingActive(active).build());
    }

    /** Refresh the last seen time of a peer after any message from it. */
    @CanIgnoreReturnValue
    public Optional<Peer> touch(@NonNull String peerId) {
        return update(peerId, peer -> peer.toBuilder().setLastSeen(mClock.instant()).build());
    }

    /**
     * Forget a peer that discovery lost. Active peers are kept.
     *
     * @return true if the peer was removed.
     */
    @CanIgnoreReturnValue
    public boolean remove(@NonNull String peerId) {
        Peer existing = mPeers.get(peerId);
        if (existing == null || existing.isActive()) {
            return false;
        }
        mEstimator.forget(peerId);
        removeInternal(peerId);
        return true;
    }

    public Optional<Peer> get(@NonNull String peerId) {
        return Optional.ofNullable(mPeers.get(peerId));
    }

    /** @return every peer in insertion order. */
    public ImmutableList<Peer> peers() {
        return ImmutableList.copyOf(mPeers.values());
    }

    /** @return peers that are connected or paired. */
    public ImmutableList<Peer> activePeers() {
        return mPeers.values().stream().filter(Peer::isActive).collect(
                ImmutableList.toImmutableList());
    }

    /** @return peers that are neither connected nor paired. */
    public ImmutableList<Peer> discoverablePeers() {
        return mPeers.values().stream().filter(peer -> !peer.isActive()).collect(
                ImmutableList.toImmutableList());
    }

    public boolean hasConnectedPairedPeer() {
        return mPeers.values().stream().anyMatch(
                peer -> peer.getPairingState() == PairingState.PAIRED
                        && peer.getConnectionState() == ConnectionState.CONNECTED);
    }

    /** @return the first connected peer in insertion order. */
    public Optional<Peer> primaryActivePeer() {
        return mPeers.values().stream()
                .filter(peer -> peer.getConnectionState() == ConnectionState.CONNECTED)
                .findFirst();
    }

    @VisibleForTesting
    public int size() {
        return mPeers.size();
    }

    private Peer setConnectionState(String peerId, ConnectionState state) {
        Instant now = mClock.instant();
        Peer existing = mPeers.get(peerId);
        Peer.Builder builder = existing == null
                ? Peer.builder(peerId, now)
                : existing.toBuilder().setLastSeen(now);
        if (existing == null || existing.getConnectionState() != state) {
            LOG.info("{} -> {}", peerId, state);
        }
        return put(builder.setConnectionState(state).build());
    }

    private Optional<Peer> update(String peerId, UnaryOperator<Peer> change) {
        Peer existing = mPeers.get(peerId);
        if (existing == null) {
            return Optional.empty();
        }
        return Optional.of(put(change.apply(existing)));
    }

    private Peer put(Peer peer) {
        Peer previous = mPeers.put(peer.getId(), peer);
        if (!peer.equals(previous)) {
            mListener.onPeerUpdated(peer);
        }
        return peer;
    }

    private void removeInternal(String peerId) {
        if (mPeers.remove(peerId) != null) {
            mListener.onPeerRemoved(peerId);
        }
    }
}
