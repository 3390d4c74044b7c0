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

import org.checkerframework.checker.nullness.qual.NonNull;

/** Kinds of message exchanged between peers, with their wire tags. */
public enum PeerMessageType {
    HANDSHAKE("handshake"),
    HEARTBEAT("heartbeat"),
    VOLUME_SYNC("volumeSync"),
    DISCONNECT("disconnect"),
    DISCOVERY_TOKEN("discoveryToken"),
    TOKEN_ACK("tokenAck"),
    PAIRING_REQUEST("pairingRequest"),
    PAIRING_ACCEPT("pairingAccept"),
    PAIRING_REJECT("pairingReject"),
    DEVICE_INFO("deviceInfo"),
    AUDIO_STREAM("audioStream"),
    /** Any tag this version does not know. Never sent. */
    UNKNOWN("");

    private final String mTag;

    PeerMessageType(String tag) {
        mTag = tag;
    }

    /** @return the tag written on the wire. */
    public @NonNull String getTag() {
        return mTag;
    }

    /** @return the type with the provided tag, or {@link #UNKNOWN}. */
    public static @NonNull PeerMessageType fromTag(@NonNull String tag) {
        for (PeerMessageType type : values()) {
            if (type != UNKNOWN && type.mTag.equals(tag)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
