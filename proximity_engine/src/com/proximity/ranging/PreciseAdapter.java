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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Callable;

/** Ranging adapter for dedicated ranging hardware. Measurements are reported in meters. */
public class PreciseAdapter extends SourceAdapter<PreciseRangingSource> {
    private static final Logger LOG = LoggerFactory.getLogger(PreciseAdapter.class);

    public PreciseAdapter(@NonNull PreciseRangingSource source,
            @NonNull ListeningExecutorService executorService, @NonNull Clock clock) {
        super(source, executorService, clock);
    }

    @Override
    public RangingTechnology getType() {
        return RangingTechnology.PRECISE;
    }

    @Override
    protected RangingData.Builder newRangingData(double value) {
        return new RangingData.Builder()
                .setTechnology(RangingTechnology.PRECISE)
                .setRangeDistance(value);
    }

    /**
     * Begin targeted ranging with a peer.
     *
     * @return a future that fails with {@link RangingException} if the source rejects the token.
     */
    public ListenableFuture<Void> configurePeer(@NonNull String peerId, byte @NonNull [] token) {
        byte[] copy = token.clone();
        Callable<Void> configure = () -> {
            LOG.info("Configuring precise ranging with {}", peerId);
            mSource.configurePeer(peerId, copy);
            return null;
        };
        return Futures.submit(configure, mExecutorService);
    }

    /** Stop targeted ranging with a peer. */
    public void removePeer(@NonNull String peerId) {
        mExecutorService.execute(() -> mSource.removePeer(peerId));
    }
}
