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

package com.proximity.ranging;

import org.checkerframework.checker.nullness.qual.NonNull;

/** A {@link RangingSource} that needs each peer's ranging token before it can target it. */
public interface PreciseRangingSource extends RangingSource {

    /**
     * Begin targeted ranging with a peer.
     *
     * @param peerId    of the counterpart.
     * @param peerToken opaque ranging token received from the counterpart.
     * @throws RangingException if the token is rejected or no session is running.
     */
    void configurePeer(@NonNull String peerId, byte @NonNull [] peerToken)
            throws RangingException;

    /** Stop ranging with a peer. Does nothing if the peer was never configured. */
    void removePeer(@NonNull String peerId);
}
