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

package com.proximity.transport;

import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * Boundary to the short range link that carries bytes between peers. Inbound events (peer found,
 * lost, connecting, connected, disconnected, bytes received) are delivered by the implementation
 * to the engine's corresponding methods.
 */
public interface Transport {

    /**
     * Send bytes to one connected peer.
     *
     * @throws TransportException if the peer is not reachable.
     */
    void send(@NonNull String peerId, byte @NonNull [] bytes) throws TransportException;

    /**
     * Send bytes to every connected peer.
     *
     * @throws TransportException if the bytes could not be handed off.
     */
    void broadcast(byte @NonNull [] bytes) throws TransportException;

    /** Begin advertising this device and browsing for peers. */
    void startDiscovery();

    /** Stop advertising and browsing. Existing connections are kept. */
    void stopDiscovery();
}
