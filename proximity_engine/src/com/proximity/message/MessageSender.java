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

package com.proximity.message;

import com.proximity.transport.Transport;
import com.proximity.transport.TransportException;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/** Stamps, encodes and hands {@link PeerMessage}s to the {@link Transport}. */
public class MessageSender {
    private static final Logger LOG = LoggerFactory.getLogger(MessageSender.class);

    private final Transport mTransport;
    private final PeerMessageCodec mCodec;
    private final Clock mClock;

    public MessageSender(
            @NonNull Transport transport, @NonNull PeerMessageCodec codec, @NonNull Clock clock) {
        mTransport = transport;
        mCodec = codec;
        mClock = clock;
    }

    /** Send a message without payload to one peer. */
    public void send(@NonNull String peerId, @NonNull PeerMessageType type)
            throws TransportException {
        send(peerId, type, Map.of());
    }

    /** Send a message to one peer. */
    public void send(@NonNull String peerId, @NonNull PeerMessageType type,
            @NonNull Map<String, String> payload) throws TransportException {
        PeerMessage message = PeerMessage.create(type, Instant.now(mClock), payload);
        LOG.debug("Sending {} to {}", type, peerId);
        mTransport.send(peerId, mCodec.encode(message));
    }

    /** Send a message to every connected peer. */
    public void broadcast(@NonNull PeerMessageType type, @NonNull Map<String, String> payload)
            throws TransportException {
        PeerMessage message = PeerMessage.create(type, Instant.now(mClock), payload);
        LOG.debug("Broadcasting {}", type);
        mTransport.broadcast(mCodec.encode(message));
    }
}
