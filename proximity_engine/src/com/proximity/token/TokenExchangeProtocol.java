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

package com.proximity.token;

import com.proximity.message.MessageDecodeException;
import com.proximity.message.MessageSender;
import com.proximity.message.PeerMessage;
import com.proximity.message.PeerMessageCodec;
import com.proximity.message.PeerMessageType;
import com.proximity.peer.ConnectionState;
import com.proximity.peer.Peer;
import com.proximity.peer.PeerRegistry;
import com.proximity.ranging.RangingProvider;
import com.proximity.transport.TransportException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Swaps precise ranging tokens with each connected peer. Either side reaches COMPLETED on its own:
 * by getting an acknowledgement for the token it sent, or by configuring its precise session with
 * the token it received.
 *
 * <p>Not thread safe, confined to the engine's executor.
 */
public class TokenExchangeProtocol {
    private static final Logger LOG = LoggerFactory.getLogger(TokenExchangeProtocol.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /** Notified when an exchange finishes or is undone. */
    public interface Listener {
        void onExchangeCompleted(@NonNull String peerId);

        /** A completed exchange no longer holds, e.g. because precise ranging stopped. */
        void onExchangeReset(@NonNull String peerId);
    }

    private final PeerRegistry mRegistry;
    private final RangingProvider mRangingProvider;
    private final MessageSender mSender;
    private final ScheduledExecutorService mExecutor;
    private final Duration mTimeout;
    private final String mLocalDisplayName;
    private final Listener mListener;

    private final Map<String, TokenExchangeState> mStates = new HashMap<>();
    private final Map<String, byte[]> mPeerTokens = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> mTimers = new HashMap<>();

    public TokenExchangeProtocol(
            @NonNull PeerRegistry registry,
            @NonNull RangingProvider rangingProvider,
            @NonNull MessageSender sender,
            @NonNull ScheduledExecutorService executor,
            @NonNull Duration timeout,
            @NonNull String localDisplayName,
            @NonNull Listener listener
    ) {
        mRegistry = registry;
        mRangingProvider = rangingProvider;
        mSender = sender;
        mExecutor = executor;
        mTimeout = timeout;
        mLocalDisplayName = localDisplayName;
        mListener = listener;
    }

    public @NonNull TokenExchangeState getState(@NonNull String peerId) {
        return mStates.getOrDefault(peerId, TokenExchangeState.IDLE);
    }

    /** @return the token received from the peer, if any. */
    public Optional<byte[]> getPeerToken(@NonNull String peerId) {
        return Optional.ofNullable(mPeerTokens.get(peerId)).map(byte[]::clone);
    }

    /** @return true if at least one peer has a completed exchange. */
    public boolean hasCompletedExchange() {
        return mStates.containsValue(TokenExchangeState.COMPLETED);
    }

    /**
     * Send our token to a peer, if precise ranging is active and has published one.
     *
     * @return true if the token was sent.
     * @throws TransportException if sending failed; the peer stays IDLE.
     */
    @CanIgnoreReturnValue
    public boolean initiate(@NonNull String peerId) throws TransportException {
        Optional<byte[]> localToken = mRangingProvider.getLocalToken();
        if (!mRangingProvider.isPreciseActive() || localToken.isEmpty()) {
            LOG.debug("Not sending token to {}: precise ranging not ready", peerId);
            return false;
        }
        TokenExchangeState state = getState(peerId);
        if (state != TokenExchangeState.IDLE) {
            LOG.debug("Not sending token to {}: exchange is {}", peerId, state);
            return false;
        }
        mStates.put(peerId, TokenExchangeState.WAITING);
        try {
            mSender.send(peerId, PeerMessageType.DISCOVERY_TOKEN, Map.of(
                    PeerMessage.Keys.TOKEN, PeerMessageCodec.encodeBinary(localToken.get()),
                    PeerMessage.Keys.SENDER, mLocalDisplayName));
        } catch (TransportException e) {
            LOG.warn("Failed to send token to {}", peerId, e);
            mStates.remove(peerId);
            throw e;
        }
        LOG.info("Sent ranging token to {}", peerId);
        scheduleTimeout(peerId);
        return true;
    }

    /** Handle a discovery token message. Malformed tokens are dropped without a state change. */
    public void handleDiscoveryToken(@NonNull String peerId, @NonNull PeerMessage message) {
        Optional<String> encoded = message.get(PeerMessage.Keys.TOKEN);
        if (encoded.isEmpty()) {
            LOG.warn("Dropping token message from {}: no token", peerId);
            return;
        }
        byte[] token;
        try {
            token = PeerMessageCodec.decodeBinary(encoded.get());
        } catch (MessageDecodeException e) {
            LOG.warn("Dropping token message from {}", peerId, e);
            return;
        }
        if (token.length == 0) {
            LOG.warn("Dropping token message from {}: empty token", peerId);
            return;
        }

        mPeerTokens.put(peerId, token);
        if (getState(peerId) != TokenExchangeState.COMPLETED) {
            mStates.put(peerId, TokenExchangeState.RECEIVED);
        }
        LOG.info("Received ranging token from {}", peerId);

        if (!mRangingProvider.isPreciseActive()) {
            LOG.info("Holding token from {} until precise ranging is active", peerId);
            return;
        }
        configure(peerId, token);
    }

    /** Handle a token acknowledgement message. */
    public void handleTokenAck(@NonNull String peerId) {
        if (getState(peerId) != TokenExchangeState.WAITING) {
            LOG.debug("Ignoring token ack from {} in state {}", peerId, getState(peerId));
            return;
        }
        complete(peerId);
    }

    /**
     * Start the exchange with every connected peer once precise ranging has published a token,
     * and configure the session with tokens that arrived before it did.
     */
    public void onLocalTokenAvailable() {
        for (Peer peer : mRegistry.activePeers()) {
            if (peer.getConnectionState() != ConnectionState.CONNECTED) {
                continue;
            }
            String peerId = peer.getId();
            byte[] held = mPeerTokens.get(peerId);
            if (getState(peerId) == TokenExchangeState.RECEIVED && held != null) {
                configure(peerId, held);
                continue;
            }
            try {
                initiate(peerId);
            } catch (TransportException e) {
                LOG.warn("Could not start token exchange with {}", peerId, e);
            }
        }
    }

    /** Forget everything about the exchange with a peer whose link went away. */
    public void onPeerDisconnected(@NonNull String peerId) {
        cancelTimeout(peerId);
        mPeerTokens.remove(peerId);
        mStates.remove(peerId);
        mRangingProvider.removePeer(peerId);
    }

    /** Undo every exchange after the precise session stopped. */
    public void onPreciseRangingLost() {
        for (String peerId : ImmutableList.copyOf(mStates.keySet())) {
            TokenExchangeState previous = mStates.remove(peerId);
            cancelTimeout(peerId);
            mRegistry.setPreciseRangingActive(peerId, false);
            if (previous == TokenExchangeState.COMPLETED) {
                mListener.onExchangeReset(peerId);
            }
        }
        mPeerTokens.clear();
    }

    /** Cancel every timer and forget all exchanges. */
    public void shutdown() {
        for (ScheduledFuture<?> future : mTimers.values()) {
            future.cancel(false);
        }
        mTimers.clear();
        mStates.clear();
        mPeerTokens.clear();
    }

    @VisibleForTesting
    public boolean hasPendingTimeout(@NonNull String peerId) {
        return mTimers.containsKey(peerId);
    }

    private void configure(String peerId, byte[] token) {
        Futures.addCallback(mRangingProvider.configurePeer(peerId, token),
                new FutureCallback<Void>() {
                    @Override
                    public void onSuccess(Void result) {
                        if (!Arrays.equals(mPeerTokens.get(peerId), token)) {
                            LOG.debug("Token for {} changed while configuring, skipping", peerId);
                            return;
                        }
                        mRegistry.setPreciseRangingActive(peerId, true);
                        try {
                            mSender.send(peerId, PeerMessageType.TOKEN_ACK,
                                    Map.of(PeerMessage.Keys.ACK, "true"));
                        } catch (TransportException e) {
                            LOG.warn("Failed to acknowledge token from {}", peerId, e);
                        }
                        if (getState(peerId) != TokenExchangeState.COMPLETED) {
                            complete(peerId);
                        }
                    }

                    @Override
                    public void onFailure(@NonNull Throwable t) {
                        LOG.warn("Failed to configure precise ranging with {}", peerId, t);
                        if (!Arrays.equals(mPeerTokens.get(peerId), token)
                                || getState(peerId) != TokenExchangeState.RECEIVED) {
                            return;
                        }
                        mPeerTokens.remove(peerId);
                        if (mTimers.containsKey(peerId)) {
                            // Our token is still out; its ack or timeout settles the exchange.
                            mStates.put(peerId, TokenExchangeState.WAITING);
                        } else {
                            mStates.remove(peerId);
                        }
                    }
                }, mExecutor);
    }

    private void complete(String peerId) {
        cancelTimeout(peerId);
        mStates.put(peerId, TokenExchangeState.COMPLETED);
        LOG.info("Token exchange with {} completed", peerId);
        mListener.onExchangeCompleted(peerId);
    }

    private void scheduleTimeout(String peerId) {
        cancelTimeout(peerId);
        mTimers.put(peerId, mExecutor.schedule(
                () -> onTimeout(peerId), mTimeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void cancelTimeout(String peerId) {
        ScheduledFuture<?> future = mTimers.remove(peerId);
        if (future != null) {
            future.cancel(false);
        }
    }

    private void onTimeout(String peerId) {
        mTimers.remove(peerId);
        if (getState(peerId) == TokenExchangeState.WAITING) {
            LOG.info("Token exchange with {} timed out", peerId);
            mStates.remove(peerId);
        }
    }
}
