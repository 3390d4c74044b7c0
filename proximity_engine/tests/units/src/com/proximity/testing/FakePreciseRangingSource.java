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

package com.proximity.testing;

import com.proximity.ranging.PreciseRangingSource;
import com.proximity.ranging.RangingException;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/** A {@link PreciseRangingSource} driven by the test. */
public class FakePreciseRangingSource implements PreciseRangingSource {
    private boolean mAvailable = true;
    private boolean mFailOnStart = false;
    private @Nullable Listener mListener;
    private final Map<String, byte[]> mConfiguredPeers = new LinkedHashMap<>();

    public synchronized void setAvailable(boolean available) {
        mAvailable = available;
    }

    public synchronized void setFailOnStart(boolean failOnStart) {
        mFailOnStart = failOnStart;
    }

    @Override
    public synchronized boolean isAvailable() {
        return mAvailable;
    }

    @Override
    public synchronized void start(@NonNull Listener listener) throws RangingException {
        if (mFailOnStart) {
            throw new RangingException("Ranging permission denied");
        }
        mListener = listener;
    }

    @Override
    public synchronized void stop() {
        mListener = null;
        mConfiguredPeers.clear();
    }

    @Override
    public synchronized void configurePeer(@NonNull String peerId, byte @NonNull [] peerToken)
            throws RangingException {
        if (mListener == null) {
            throw new RangingException("No session running");
        }
        mConfiguredPeers.put(peerId, peerToken.clone());
    }

    @Override
    public synchronized void removePeer(@NonNull String peerId) {
        mConfiguredPeers.remove(peerId);
    }

    public synchronized boolean isStarted() {
        return mListener != null;
    }

    /** @return the token each configured peer was set up with. */
    public synchronized ImmutableMap<String, byte[]> getConfiguredPeers() {
        return ImmutableMap.copyOf(mConfiguredPeers);
    }

    public void emitToken(byte[] token) {
        listener().onLocalToken(token);
    }

    public void emitMeasurement(@Nullable String peerId, double meters) {
        listener().onMeasurement(peerId, meters);
    }

    /** Stop the session as if the hardware failed. */
    public void invalidate() {
        Listener listener = listener();
        synchronized (this) {
            mListener = null;
            mConfiguredPeers.clear();
        }
        listener.onInvalidated(new IllegalStateException("Ranging hardware reset"));
    }

    private synchronized Listener listener() {
        if (mListener == null) {
            throw new IllegalStateException("Source is not started");
        }
        return mListener;
    }
}
