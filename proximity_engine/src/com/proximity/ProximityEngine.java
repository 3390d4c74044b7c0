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

import com.proximity.pairing.PairedDevice;
import com.proximity.peer.Peer;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Comparator;
import java.util.Map;

/**
 * Tracks nearby peers, estimates their distance and runs the pairing and ranging token protocols
 * with them. Every method may be called from any thread; the work is serialized onto the engine's
 * executor.
 */
public interface ProximityEngine {

    /** Starts discovery and ranging. Leaves ERROR first if needed. */
    void start();

    /** Stops discovery and ranging and returns to IDLE. */
    void stop();

    /**
     * Transport event: a peer was discovered or rediscovered.
     *
     * @param metadata advertised by the peer; a {@code version} key marks a compatible peer.
     * @param rssi     signal strength of the advertisement in dBm, if known.
     */
    void onPeerFound(@NonNull String peerId, @NonNull String displayName,
            @NonNull Map<String, String> metadata, @Nullable Integer rssi);

    /** Transport event: discovery no longer sees a peer. */
    void onPeerLost(@NonNull String peerId);

    /** Transport event: a link to a peer is being established. */
    void onPeerConnecting(@NonNull String peerId);

    /** Transport event: a link to a peer is up. */
    void onPeerConnected(@NonNull String peerId);

    /** Transport event: the link to a peer is gone. */
    void onPeerDisconnected(@NonNull String peerId);

    /** Transport event: bytes arrived from a peer. */
    void onMessageReceived(@NonNull String peerId, byte @NonNull [] bytes);

    /**
     * Ask a peer to pair.
     *
     * @return a future resolving to false if the request was not legal, or failing with
     * {@link com.proximity.transport.TransportException} if it could not be sent.
     */
    ListenableFuture<Boolean> requestPairing(@NonNull String peerId);

    /** Accept a surfaced pairing request. */
    ListenableFuture<Boolean> acceptPairing(@NonNull String peerId);

    /** Reject a surfaced pairing request. */
    ListenableFuture<Boolean> rejectPairing(@NonNull String peerId);

    /** Forget a paired peer. */
    ListenableFuture<Boolean> unpair(@NonNull String peerId);

    /** Toggle the selection of a peer. At most one peer is selected. */
    void select(@NonNull String peerId);

    /** Remove stale peers now instead of waiting for the periodic purge. */
    void purgeStale();

    /** Send our current volume and distance for a connected peer to that peer. */
    ListenableFuture<Boolean> syncVolume(@NonNull String peerId);

    /**
     * Report a failure of a subsystem outside the engine, e.g. audio. Enters ERROR unless a paired
     * peer is connected, in which case a notice is published instead.
     */
    void reportSubsystemFailure(@NonNull String message);

    /** @return a snapshot of every known peer. */
    @NonNull ImmutableList<Peer> getPeers();

    /**
     * @param ordering one of the {@link com.proximity.peer.PeerOrdering} comparators, or any other.
     * @return a snapshot of every known peer, sorted.
     */
    @NonNull ImmutableList<Peer> getPeers(@NonNull Comparator<Peer> ordering);

    /** @return the current application state. */
    @NonNull AppState getState();

    /** Callback for {@link ProximityEngine} events, invoked on the engine's executor. */
    interface Callback {
        void onPeerUpdated(@NonNull Peer peer);

        void onPeerRemoved(@NonNull String peerId);

        void onStateChanged(@NonNull AppState state, @Nullable String errorMessage);

        /** A peer asks to pair; answer with accept or reject. */
        void onPairingRequest(@NonNull String peerId, @NonNull String displayName);

        /** The request surfaced by {@link #onPairingRequest} is gone; dismiss it. */
        void onPairingRequestWithdrawn(@NonNull String peerId);

        void onPairedDevicesChanged(@NonNull ImmutableList<PairedDevice> pairedDevices);

        /** A non fatal condition the user should know about. */
        void onNotice(@NonNull String notice);
    }
}
