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

import com.proximity.distance.DistanceEstimator;
import com.proximity.message.MessageDecodeException;
import com.proximity.message.MessageSender;
import com.proximity.message.PeerMessage;
import com.proximity.message.PeerMessageCodec;
import com.proximity.message.PeerMessageType;
import com.proximity.pairing.PairedDevice;
import com.proximity.pairing.PairingProtocol;
import com.proximity.pairing.PairingStore;
import com.proximity.peer.ConnectionState;
import com.proximity.peer.Peer;
import com.proximity.peer.PeerOrdering;
import com.proximity.peer.PeerRegistry;
import com.proximity.ranging.RangingData;
import com.proximity.ranging.RangingProvider;
import com.proximity.ranging.RangingTechnology;
import com.proximity.ranging.fusion.DataFusers;
import com.proximity.token.TokenExchangeProtocol;
import com.proximity.transport.Transport;
import com.proximity.transport.TransportException;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Composition root of the proximity engine. Owns the peer registry and the protocols, and confines
 * them to a single executor that every inbound event is posted to.
 */
public final class ProximityEngineImpl implements ProximityEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ProximityEngineImpl.class);

    static final String METADATA_VERSION = "version";

    private final EngineConfig mConfig;
    private final Transport mTransport;
    private final RangingProvider mRangingProvider;
    private final ScheduledExecutorService mExecutor;
    private final Clock mClock;
    private final Callback mCallback;

    private final PeerMessageCodec mCodec;
    private final MessageSender mSender;
    private final PeerRegistry mRegistry;
    private final PairingProtocol mPairing;
    private final TokenExchangeProtocol mTokenExchange;
    private final AppStateMachine mStateMachine;

    /** Published copy of the registry for readers off the executor. */
    private volatile ImmutableList<Peer> mPeerSnapshot = ImmutableList.of();

    private boolean mPairedDevicesLoaded = false;
    private @Nullable ScheduledFuture<?> mPurgeTask;
    private @Nullable ScheduledFuture<?> mHeartbeatTask;

    /**
     * @param rangingProvider must post its callbacks to {@code executor}.
     * @param executor        single threaded executor owned by the caller. All engine state is
     *                        confined to it.
     */
    public ProximityEngineImpl(
            @NonNull EngineConfig config,
            @NonNull Transport transport,
            @NonNull RangingProvider rangingProvider,
            @NonNull PairingStore pairingStore,
            @NonNull ScheduledExecutorService executor,
            @NonNull Clock clock,
            @NonNull Callback callback
    ) {
        mConfig = config;
        mTransport = transport;
        mRangingProvider = rangingProvider;
        mExecutor = executor;
        mClock = clock;
        mCallback = callback;

        mCodec = new PeerMessageCodec();
        mSender = new MessageSender(transport, mCodec, clock);
        mRegistry = new PeerRegistry(
                new DistanceEstimator(config.getDistanceConfig()),
                new DataFusers.PreferentialDataFuser(RangingTechnology.PRECISE),
                clock,
                config.getStaleTimeout(),
                new RegistryListener());
        mPairing = new PairingProtocol(mRegistry, mSender, pairingStore, executor, clock,
                config.getPairingTimeout(), config.getLocalDisplayName(), new PairingListener());
        mTokenExchange = new TokenExchangeProtocol(mRegistry, rangingProvider, mSender, executor,
                config.getTokenExchangeTimeout(), config.getLocalDisplayName(),
                new TokenExchangeListener());
        mStateMachine = new AppStateMachine(mCallback::onStateChanged);
    }

    @Override
    public void start() {
        mExecutor.execute(this::startInternal);
    }

    @Override
    public void stop() {
        mExecutor.execute(this::stopInternal);
    }

    @Override
    public void onPeerFound(@NonNull String peerId, @NonNull String displayName,
            @NonNull Map<String, String> metadata, @Nullable Integer rssi) {
        Map<String, String> metadataCopy = Map.copyOf(metadata);
        mExecutor.execute(() -> {
            mRegistry.upsertDiscovered(peerId, displayName, rssi);
            if (metadataCopy.containsKey(METADATA_VERSION)) {
                mRegistry.setCompatible(peerId, true);
            }
        });
    }

    @Override
    public void onPeerLost(@NonNull String peerId) {
        mExecutor.execute(() -> mRegistry.remove(peerId));
    }

    @Override
    public void onPeerConnecting(@NonNull String peerId) {
        mExecutor.execute(() -> mRegistry.markConnecting(peerId));
    }

    @Override
    public void onPeerConnected(@NonNull String peerId) {
        mExecutor.execute(() -> handlePeerConnected(peerId));
    }

    @Override
    public void onPeerDisconnected(@NonNull String peerId) {
        mExecutor.execute(() -> handlePeerDisconnected(peerId));
    }

    @Override
    public void onMessageReceived(@NonNull String peerId, byte @NonNull [] bytes) {
        byte[] copy = bytes.clone();
        mExecutor.execute(() -> handleMessage(peerId, copy));
    }

    @Override
    public ListenableFuture<Boolean> requestPairing(@NonNull String peerId) {
        return submit(() -> mPairing.requestPairing(peerId));
    }

    @Override
    public ListenableFuture<Boolean> acceptPairing(@NonNull String peerId) {
        return submit(() -> mPairing.acceptPairing(peerId));
    }

    @Override
    public ListenableFuture<Boolean> rejectPairing(@NonNull String peerId) {
        return submit(() -> mPairing.rejectPairing(peerId));
    }

    @Override
    public ListenableFuture<Boolean> unpair(@NonNull String peerId) {
        return submit(() -> mPairing.unpair(peerId));
    }

    @Override
    public void select(@NonNull String peerId) {
        mExecutor.execute(() -> mRegistry.select(peerId));
    }

    @Override
    public void purgeStale() {
        mExecutor.execute(() -> mRegistry.purgeStale(mClock.instant()));
    }

    @Override
    public ListenableFuture<Boolean> syncVolume(@NonNull String peerId) {
        return submit(() -> {
            Optional<Peer> peer = mRegistry.get(peerId);
            if (peer.isEmpty() || peer.get().getConnectionState() != ConnectionState.CONNECTED) {
                LOG.warn("Not syncing volume with {}: not connected", peerId);
                return false;
            }
            mSender.send(peerId, PeerMessageType.VOLUME_SYNC, Map.of(
                    PeerMessage.Keys.VOLUME, Double.toString(peer.get().getVolume()),
                    PeerMessage.Keys.DISTANCE, Double.toString(peer.get().getDistance())));
            return true;
        });
    }

    @Override
    public void reportSubsystemFailure(@NonNull String message) {
        mExecutor.execute(() -> fail(message));
    }

    @Override
    public @NonNull ImmutableList<Peer> getPeers() {
        return mPeerSnapshot;
    }

    @Override
    public @NonNull ImmutableList<Peer> getPeers(@NonNull Comparator<Peer> ordering) {
        return PeerOrdering.sorted(mPeerSnapshot, ordering);
    }

    @Override
    public @NonNull AppState getState() {
        return mStateMachine.getState();
    }

    private <T> ListenableFuture<T> submit(Callable<T> task) {
        return Futures.submit(task, mExecutor);
    }

    private void startInternal() {
        if (mStateMachine.isIn(AppState.ERROR)) {
            mStateMachine.transition(AppState.IDLE);
        }
        if (!mStateMachine.isIn(AppState.IDLE)) {
            LOG.warn("Ignoring start in state {}", mStateMachine.getState());
            return;
        }
        LOG.info("Starting engine as {}", mConfig.getLocalPeerId());
        if (!mPairedDevicesLoaded) {
            mPairing.loadPairedDevices();
            mPairedDevicesLoaded = true;
        }
        mStateMachine.transition(AppState.DISCOVERING);
        mTransport.startDiscovery();
        mRangingProvider.start(new RangingListener());

        cancelTimers();
        Duration purgeInterval = mConfig.getPurgeInterval();
        mPurgeTask = mExecutor.scheduleAtFixedRate(
                () -> mRegistry.purgeStale(mClock.instant()),
                purgeInterval.toMillis(), purgeInterval.toMillis(), TimeUnit.MILLISECONDS);
        Duration heartbeatInterval = mConfig.getHeartbeatInterval();
        if (!heartbeatInterval.isZero()) {
            mHeartbeatTask = mExecutor.scheduleAtFixedRate(this::sendHeartbeat,
                    heartbeatInterval.toMillis(), heartbeatInterval.toMillis(),
                    TimeUnit.MILLISECONDS);
        }
    }

    private void stopInternal() {
        if (mStateMachine.isIn(AppState.IDLE)) {
            LOG.debug("Engine already stopped");
            return;
        }
        LOG.info("Stopping engine");
        cancelTimers();
        mRangingProvider.stop();
        mTransport.stopDiscovery();
        mTokenExchange.onPreciseRangingLost();
        mTokenExchange.shutdown();
        mPairing.shutdown();

        if (mStateMachine.isIn(AppState.TRANSMITTING)) {
            mStateMachine.transition(AppState.CONNECTED);
        }
        mStateMachine.transition(AppState.IDLE);
    }

    private void cancelTimers() {
        if (mPurgeTask != null) {
            mPurgeTask.cancel(false);
            mPurgeTask = null;
        }
        if (mHeartbeatTask != null) {
            mHeartbeatTask.cancel(false);
            mHeartbeatTask = null;
        }
    }

    private void fail(String message) {
        if (!mStateMachine.fail(message, mRegistry.hasConnectedPairedPeer())) {
            mCallback.onNotice(message);
        }
    }

    private void handlePeerConnected(String peerId) {
        mRegistry.markConnected(peerId);
        mPairing.onPeerConnected(peerId);
        if (mStateMachine.isIn(AppState.DISCOVERING)) {
            mStateMachine.transition(AppState.CONNECTED);
        }
        try {
            mSender.send(peerId, PeerMessageType.DEVICE_INFO, Map.of(
                    PeerMessage.Keys.NAME, mConfig.getLocalDisplayName(),
                    PeerMessage.Keys.COMPATIBLE, Boolean.TRUE.toString()));
        } catch (TransportException e) {
            LOG.warn("Failed to send device info to {}", peerId, e);
        }
        try {
            mTokenExchange.initiate(peerId);
        } catch (TransportException e) {
            LOG.warn("Failed to start token exchange with {}", peerId, e);
        }
    }

    private void handlePeerDisconnected(String peerId) {
        mPairing.onPeerDisconnected(peerId);
        mTokenExchange.onPeerDisconnected(peerId);
        mRegistry.markDisconnected(peerId);
        leaveTransmittingIfIdle();
    }

    private void handleMessage(String peerId, byte[] bytes) {
        PeerMessage message;
        try {
            message = mCodec.decode(bytes);
        } catch (MessageDecodeException e) {
            LOG.warn("Dropping undecodable message from {}", peerId, e);
            return;
        }
        mRegistry.touch(peerId);
        switch (message.getType()) {
            case HANDSHAKE:
            case HEARTBEAT:
            case VOLUME_SYNC:
                break;
            case DISCONNECT:
                mPairing.handleRemoteUnpair(peerId);
                break;
            case DISCOVERY_TOKEN:
                mTokenExchange.handleDiscoveryToken(peerId, message);
                break;
            case TOKEN_ACK:
                mTokenExchange.handleTokenAck(peerId);
                break;
            case PAIRING_REQUEST:
                mPairing.handleIncomingRequest(peerId, message);
                break;
            case PAIRING_ACCEPT:
                mPairing.handleAccept(peerId);
                break;
            case PAIRING_REJECT:
                mPairing.handleReject(peerId);
                break;
            case DEVICE_INFO:
                mRegistry.updateDeviceInfo(peerId,
                        message.get(PeerMessage.Keys.NAME).orElse(null),
                        message.get(PeerMessage.Keys.COMPATIBLE).map(Boolean::parseBoolean)
                                .orElse(null));
                break;
            case AUDIO_STREAM:
            case UNKNOWN:
            default:
                LOG.debug("Ignoring {} from {}", message.getType(), peerId);
                break;
        }
    }

    private void sendHeartbeat() {
        boolean anyConnected = mRegistry.peers().stream()
                .anyMatch(peer -> peer.getConnectionState() == ConnectionState.CONNECTED);
        if (!anyConnected) {
            return;
        }
        try {
            mSender.broadcast(PeerMessageType.HEARTBEAT, Map.of());
        } catch (TransportException e) {
            LOG.warn("Failed to broadcast heartbeat", e);
        }
    }

    private void leaveTransmittingIfIdle() {
        if (mStateMachine.isIn(AppState.TRANSMITTING) && !mTokenExchange.hasCompletedExchange()) {
            mStateMachine.transition(AppState.CONNECTED);
        }
    }

    private class RegistryListener implements PeerRegistry.Listener {
        @Override
        public void onPeerUpdated(@NonNull Peer peer) {
            mPeerSnapshot = mRegistry.peers();
            mCallback.onPeerUpdated(peer);
        }

        @Override
        public void onPeerRemoved(@NonNull String peerId) {
            mPeerSnapshot = mRegistry.peers();
            mCallback.onPeerRemoved(peerId);
        }
    }

    private class PairingListener implements PairingProtocol.Listener {
        @Override
        public void onPairingRequest(@NonNull String peerId, @NonNull String displayName) {
            mCallback.onPairingRequest(peerId, displayName);
        }

        @Override
        public void onPairingRequestWithdrawn(@NonNull String peerId) {
            mCallback.onPairingRequestWithdrawn(peerId);
        }

        @Override
        public void onPairedDevicesChanged(@NonNull ImmutableList<PairedDevice> pairedDevices) {
            mCallback.onPairedDevicesChanged(pairedDevices);
        }
    }

    private class TokenExchangeListener implements TokenExchangeProtocol.Listener {
        @Override
        public void onExchangeCompleted(@NonNull String peerId) {
            if (mStateMachine.isIn(AppState.CONNECTED)) {
                mStateMachine.transition(AppState.TRANSMITTING);
            }
        }

        @Override
        public void onExchangeReset(@NonNull String peerId) {
            leaveTransmittingIfIdle();
        }
    }

    private class RangingListener implements RangingProvider.Callback {
        @Override
        public void onStarted(@NonNull RangingTechnology technology) {
            LOG.info("Ranging with {}", technology);
        }

        @Override
        public void onDegraded(@NonNull String notice) {
            mCallback.onNotice(notice);
        }

        @Override
        public void onUnavailable(@NonNull String message) {
            fail(message);
        }

        @Override
        public void onRangingData(@NonNull RangingData data) {
            mRegistry.applyRangingData(data);
        }

        @Override
        public void onLocalToken(byte @NonNull [] token) {
            mTokenExchange.onLocalTokenAvailable();
        }

        @Override
        public void onPreciseRangingLost() {
            mTokenExchange.onPreciseRangingLost();
            leaveTransmittingIfIdle();
        }
    }
}
