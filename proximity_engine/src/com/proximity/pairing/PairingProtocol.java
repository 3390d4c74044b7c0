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

package com.proximity.pairing;

import com.proximity.message.MessageSender;
import com.proximity.message.PeerMessage;
import com.proximity.message.PeerMessageType;
import com.proximity.peer.ConnectionState;
import com.proximity.peer.PairingState;
import com.proximity.peer.Peer;
import com.proximity.peer.PeerRegistry;
import com.proximity.transport.TransportException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per peer pairing handshake: NONE to PENDING to PAIRED, PENDING back to NONE on reject or
 * timeout, and PAIRED to NONE on unpair. Requests for any other transition are ignored.
 *
 * <p>At most one inbound request is surfaced at a time; requests arriving while one is
 * outstanding are dropped. Not thread safe, confined to the engine's executor.
 */
public class PairingProtocol {
    private static final Logger LOG = LoggerFactory.getLogger(PairingProtocol.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** Notified of pairing events that need the user's attention. */
    public interface Listener {
        /** A peer asks to pair. Answer with accept or reject. */
        void onPairingRequest(@NonNull String peerId, @NonNull String displayName);

        /** The peer withdrew the request surfaced through {@link #onPairingRequest}. */
        void onPairingRequestWithdrawn(@NonNull String peerId);

        /** The persisted list changed. */
        void onPairedDevicesChanged(@NonNull ImmutableList<PairedDevice> pairedDevices);
    }

    private final PeerRegistry mRegistry;
    private final MessageSender mSender;
    private final PairingStore mStore;
    private final ScheduledExecutorService mTimeoutExecutor;
    private final Clock mClock;
    private final Duration mTimeout;
    private final String mLocalDisplayName;
    private final Listener mListener;

    private final Map<String, ScheduledFuture<?>> mPendingTimeouts = new HashMap<>();
    private final List<PairedDevice> mPairedDevices = new ArrayList<>();

    /** Peer whose inbound request is currently surfaced, if any. */
    private @Nullable String mInboundRequest;

    public PairingProtocol(
            @NonNull PeerRegistry registry,
            @NonNull MessageSender sender,
            @NonNull PairingStore store,
            @NonNull ScheduledExecutorService timeoutExecutor,
            @NonNull Clock clock,
            @NonNull Duration timeout,
            @NonNull String localDisplayName,
            @NonNull Listener listener
    ) {
        mRegistry = registry;
        mSender = sender;
        mStore = store;
        mTimeoutExecutor = timeoutExecutor;
        mClock = clock;
        mTimeout = timeout;
        mLocalDisplayName = localDisplayName;
        mListener = listener;
        mInboundRequest = null;
    }

    /** Read the persisted list once and restore the paired peers into the registry. */
    public void loadPairedDevices() {
        mPairedDevices.clear();
        mPairedDevices.addAll(mStore.loadPairedDevices());
        for (PairedDevice device : mPairedDevices) {
            mRegistry.rehydrate(device.getId(), device.getName());
        }
        LOG.info("Loaded {} paired devices", mPairedDevices.size());
    }

    public ImmutableList<PairedDevice> getPairedDevices() {
        return ImmutableList.copyOf(mPairedDevices);
    }

    /** @return the peer whose inbound request awaits an answer, if any. */
    public Optional<String> getInboundRequest() {
        return Optional.ofNullable(mInboundRequest);
    }

    /**
     * Ask a peer to pair.
     *
     * @return false if the peer is unknown or not in NONE.
     * @throws TransportException if the request could not be sent; the peer is back in NONE.
     */
    @CanIgnoreReturnValue
    public boolean requestPairing(@NonNull String peerId) throws TransportException {
        Optional<Peer> peer = mRegistry.get(peerId);
        if (peer.isEmpty() || peer.get().getPairingState() != PairingState.NONE) {
            LOG.warn("Ignoring pairing request to {} in state {}", peerId,
                    peer.map(Peer::getPairingState).orElse(null));
            return false;
        }
        mRegistry.setPairingState(peerId, PairingState.PENDING);
        try {
            mSender.send(peerId, PeerMessageType.PAIRING_REQUEST,
                    Map.of(PeerMessage.Keys.NAME, mLocalDisplayName));
        } catch (TransportException e) {
            LOG.warn("Failed to send pairing request to {}", peerId, e);
            mRegistry.setPairingState(peerId, PairingState.NONE);
            throw e;
        }
        LOG.info("Requested pairing with {}", peerId);
        scheduleTimeout(peerId);
        return true;
    }

    /** Handle a pairing request message from a peer. */
    public void handleIncomingRequest(@NonNull String peerId, @NonNull PeerMessage message) {
        Optional<Peer> peer = mRegistry.get(peerId);
        if (peer.isEmpty()) {
            LOG.warn("Dropping pairing request from unknown peer {}", peerId);
            return;
        }
        if (peer.get().getPairingState() == PairingState.PAIRED) {
            LOG.info("{} asked to pair again, confirming", peerId);
            try {
                mSender.send(peerId, PeerMessageType.PAIRING_ACCEPT);
            } catch (TransportException e) {
                LOG.warn("Failed to confirm pairing with {}", peerId, e);
            }
            return;
        }
        if (mInboundRequest != null) {
            LOG.warn("Dropping pairing request from {}: request from {} is outstanding", peerId,
                    mInboundRequest);
            return;
        }
        String name = message.get(PeerMessage.Keys.NAME).orElse(peer.get().getDisplayName());
        mRegistry.updateDeviceInfo(peerId, name, null);
        mInboundRequest = peerId;
        LOG.info("Pairing request from {}", peerId);
        mListener.onPairingRequest(peerId, name);
    }

    /**
     * Accept the outstanding inbound request from a peer. Our own outgoing request can only be
     * completed by the other side.
     *
     * @return false if that peer has no inbound request waiting; accepting a paired peer is a
     *     no-op.
     * @throws TransportException if the acceptance could not be sent; the peer is back in NONE.
     */
    @CanIgnoreReturnValue
    public boolean acceptPairing(@NonNull String peerId) throws TransportException {
        Optional<Peer> peer = mRegistry.get(peerId);
        if (peer.isEmpty()) {
            LOG.warn("Ignoring accept for unknown peer {}", peerId);
            clearInboundRequest(peerId);
            return false;
        }
        PairingState state = peer.get().getPairingState();
        if (state == PairingState.PAIRED) {
            clearInboundRequest(peerId);
            return false;
        }
        if (!peerId.equals(mInboundRequest)) {
            LOG.warn("Ignoring accept for {}: no request from it is waiting", peerId);
            return false;
        }
        clearInboundRequest(peerId);
        cancelTimeout(peerId);
        try {
            mSender.send(peerId, PeerMessageType.PAIRING_ACCEPT);
        } catch (TransportException e) {
            LOG.warn("Failed to send pairing accept to {}", peerId, e);
            mRegistry.setPairingState(peerId, PairingState.NONE);
            throw e;
        }
        completePairing(peer.get());
        return true;
    }

    /**
     * Reject the outstanding request from a peer, or abandon our own pending request.
     *
     * @return false if there is nothing to reject.
     * @throws TransportException if the rejection could not be sent; the peer is in NONE anyway.
     */
    @CanIgnoreReturnValue
    public boolean rejectPairing(@NonNull String peerId) throws TransportException {
        Optional<Peer> peer = mRegistry.get(peerId);
        boolean pending = peer.isPresent()
                && peer.get().getPairingState() == PairingState.PENDING;
        if (!pending && !peerId.equals(mInboundRequest)) {
            LOG.warn("Ignoring reject for {}: no request outstanding", peerId);
            return false;
        }
        clearInboundRequest(peerId);
        cancelTimeout(peerId);
        mRegistry.setPairingState(peerId, PairingState.NONE);
        LOG.info("Rejected pairing with {}", peerId);
        mSender.send(peerId, PeerMessageType.PAIRING_REJECT);
        return true;
    }

    /**
     * Forget a paired peer and tell it, if it is still connected.
     *
     * @return false if the peer was not paired.
     */
    @CanIgnoreReturnValue
    public boolean unpair(@NonNull String peerId) {
        if (!removeRecord(peerId)) {
            LOG.warn("Ignoring unpair of {}: not paired", peerId);
            return false;
        }
        LOG.info("Unpaired {}", peerId);
        Optional<Peer> peer = mRegistry.setPairingState(peerId, PairingState.NONE);
        if (peer.isPresent() && peer.get().getConnectionState() == ConnectionState.CONNECTED) {
            try {
                mSender.send(peerId, PeerMessageType.DISCONNECT);
            } catch (TransportException e) {
                LOG.warn("Failed to notify {} of unpairing", peerId, e);
            }
        }
        return true;
    }

    /** Handle a pairing accept message: our pending request succeeded. */
    public void handleAccept(@NonNull String peerId) {
        Optional<Peer> peer = mRegistry.get(peerId);
        if (peer.isEmpty() || peer.get().getPairingState() != PairingState.PENDING) {
            LOG.warn("Ignoring pairing accept from {}: not pending", peerId);
            return;
        }
        cancelTimeout(peerId);
        clearInboundRequest(peerId);
        completePairing(peer.get());
    }

    /**
     * Handle a pairing reject message: either our pending request failed, or the peer withdrew
     * the request it sent us.
     */
    public void handleReject(@NonNull String peerId) {
        if (peerId.equals(mInboundRequest)) {
            mInboundRequest = null;
            LOG.info("{} withdrew its pairing request", peerId);
            mListener.onPairingRequestWithdrawn(peerId);
        }
        Optional<Peer> peer = mRegistry.get(peerId);
        if (peer.isEmpty() || peer.get().getPairingState() != PairingState.PENDING) {
            LOG.debug("No pending request to {} to reject", peerId);
            return;
        }
        cancelTimeout(peerId);
        mRegistry.setPairingState(peerId, PairingState.NONE);
        LOG.info("{} rejected pairing", peerId);
    }

    /** Handle a disconnect message: a paired peer unpaired us. */
    public void handleRemoteUnpair(@NonNull String peerId) {
        if (removeRecord(peerId)) {
            LOG.info("{} unpaired this device", peerId);
            mRegistry.setPairingState(peerId, PairingState.NONE);
        }
    }

    /** Refresh the last connection time of a paired peer. */
    public void onPeerConnected(@NonNull String peerId) {
        for (int i = 0; i < mPairedDevices.size(); i++) {
            PairedDevice device = mPairedDevices.get(i);
            if (device.getId().equals(peerId)) {
                mPairedDevices.set(i, device.withLastConnected(mClock.instant()));
                persist();
                return;
            }
        }
    }

    /** Drop per peer protocol state when the link to the peer goes away. */
    public void onPeerDisconnected(@NonNull String peerId) {
        cancelTimeout(peerId);
        clearInboundRequest(peerId);
    }

    /** Cancel every pending timeout and abandon our outstanding requests. */
    public void shutdown() {
        for (String peerId : ImmutableList.copyOf(mPendingTimeouts.keySet())) {
            cancelTimeout(peerId);
            Optional<Peer> peer = mRegistry.get(peerId);
            if (peer.isPresent() && peer.get().getPairingState() == PairingState.PENDING) {
                mRegistry.setPairingState(peerId, PairingState.NONE);
            }
        }
        mInboundRequest = null;
    }

    @VisibleForTesting
    public boolean hasPendingTimeout(@NonNull String peerId) {
        return mPendingTimeouts.containsKey(peerId);
    }

    private void completePairing(Peer peer) {
        mRegistry.setPairingState(peer.getId(), PairingState.PAIRED);
        if (mPairedDevices.stream().noneMatch(d -> d.getId().equals(peer.getId()))) {
            mPairedDevices.add(new PairedDevice(peer.getId(), peer.getDisplayName(),
                    mClock.instant(),
                    peer.getConnectionState() == ConnectionState.CONNECTED
                            ? mClock.instant() : null));
            persist();
        }
        LOG.info("Paired with {}", peer.getId());
    }

    private boolean removeRecord(String peerId) {
        boolean removed = mPairedDevices.removeIf(device -> device.getId().equals(peerId));
        if (removed) {
            persist();
        }
        return removed;
    }

    private void persist() {
        mStore.savePairedDevices(ImmutableList.copyOf(mPairedDevices));
        mListener.onPairedDevicesChanged(ImmutableList.copyOf(mPairedDevices));
    }

    private void clearInboundRequest(String peerId) {
        if (peerId.equals(mInboundRequest)) {
            mInboundRequest = null;
        }
    }

    private void scheduleTimeout(String peerId) {
        cancelTimeout(peerId);
        mPendingTimeouts.put(peerId, mTimeoutExecutor.schedule(
                () -> onTimeout(peerId), mTimeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void cancelTimeout(String peerId) {
        ScheduledFuture<?> future = mPendingTimeouts.remove(peerId);
        if (future != null) {
            future.cancel(false);
        }
    }

    private void onTimeout(String peerId) {
        mPendingTimeouts.remove(peerId);
        Optional<Peer> peer = mRegistry.get(peerId);
        if (peer.isPresent() && peer.get().getPairingState() == PairingState.PENDING) {
            LOG.info("Pairing request to {} timed out", peerId);
            mRegistry.setPairingState(peerId, PairingState.NONE);
        }
    }
}
