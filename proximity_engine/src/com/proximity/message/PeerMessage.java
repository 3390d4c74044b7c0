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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/** A message exchanged between peers. */
@AutoValue
public abstract class PeerMessage {

    /** Payload keys understood by this engine. */
    public static final class Keys {
        public static final String TOKEN = "token";
        public static final String SENDER = "sender";
        public static final String ACK = "ack";
        public static final String NAME = "name";
        public static final String COMPATIBLE = "compatible";
        public static final String VOLUME = "volume";
        public static final String DISTANCE = "distance";

        private Keys() {
        }
    }

    public abstract @NonNull PeerMessageType getType();

    public abstract @NonNull Instant getTimestamp();

    public abstract @NonNull ImmutableMap<String, String> getPayload();

    /** @return the payload value for {@code key}, if present. */
    public Optional<String> get(@NonNull String key) {
        return Optional.ofNullable(getPayload().get(key));
    }

    public static @NonNull PeerMessage create(
            @NonNull PeerMessageType type, @NonNull Instant timestamp) {
        return create(type, timestamp, ImmutableMap.of());
    }

    public static @NonNull PeerMessage create(
            @NonNull PeerMessageType type, @NonNull Instant timestamp,
            @NonNull Map<String, String> payload) {
        return new AutoValue_PeerMessage(type, timestamp, ImmutableMap.copyOf(payload));
    }
}
