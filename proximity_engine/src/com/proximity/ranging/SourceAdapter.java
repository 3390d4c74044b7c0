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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Common plumbing for adapters that drive a {@link RangingSource}. Blocking source calls run on
 * the adapter executor; their outcome is reported through {@link RangingAdapter.Callback}.
 */
abstract class SourceAdapter<S extends RangingSource> implements RangingAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(SourceAdapter.class);

    protected final S mSource;
    protected final ListeningExecutorService mExecutorService;
    private final Clock mClock;
    private final RangingSource.Listener mSourceListener = new SourceListener();
    private final ExecutorResultHandlers mResultHandlers = new ExecutorResultHandlers();

    /** Invariant: non-null while a ranging session is active */
    private volatile @Nullable Callback mCallbacks;

    SourceAdapter(@NonNull S source, @NonNull ListeningExecutorService executorService,
            @NonNull Clock clock) {
        mSource = source;
        mExecutorService = executorService;
        mClock = clock;
        mCallbacks = null;
    }

    @Override
    public ListenableFuture<Boolean> isEnabled() {
        return Futures.submit(mSource::isAvailable, mExecutorService);
    }

    @Override
    public void start(Callback callbacks) {
        LOG.info("{}: start called", getType());
        mCallbacks = callbacks;

        Callable<Void> startSource = () -> {
            mSource.start(mSourceListener);
            return null;
        };
        var future = Futures.submit(startSource, mExecutorService);
        Futures.addCallback(future, mResultHandlers.mStartRanging, mExecutorService);
    }

    @Override
    public void stop() {
        LOG.info("{}: stop called", getType());

        var future = Futures.submit(mSource::stop, mExecutorService);
        Futures.addCallback(future, mResultHandlers.mStopRanging, mExecutorService);
    }

    /** Builds the data for one measurement; {@code value} is in the source's native unit. */
    protected abstract RangingData.Builder newRangingData(double value);

    @VisibleForTesting
    public RangingSource.Listener getListener() {
        return mSourceListener;
    }

    private void clear() {
        mCallbacks = null;
    }

    private class SourceListener implements RangingSource.Listener {
        @Override
        public void onMeasurement(@Nullable String peerId, double value) {
            report(newRangingData(value).setPeerId(peerId));
        }

        @Override
        public void onMeasurement(@Nullable String peerId, double value, double azimuthRadians,
                double elevationRadians) {
            report(newRangingData(value)
                    .setPeerId(peerId)
                    .setAzimuthRadians(azimuthRadians)
                    .setElevationRadians(elevationRadians));
        }

        @Override
        public void onLocalToken(byte @NonNull [] token) {
            Callback callbacks = mCallbacks;
            if (callbacks != null) {
                callbacks.onLocalToken(token.clone());
            }
        }

        @Override
        public void onInvalidated(@NonNull Throwable cause) {
            LOG.warn("{}: source invalidated", getType(), cause);
            Callback callbacks = mCallbacks;
            if (callbacks != null) {
                callbacks.onStopped(Callback.StoppedReason.ERROR);
                clear();
            }
        }

        private void report(RangingData.Builder builder) {
            Callback callbacks = mCallbacks;
            if (callbacks == null) {
                return;
            }
            RangingData data;
            try {
                data = builder.setTimestamp(Instant.now(mClock)).build();
            } catch (IllegalArgumentException e) {
                LOG.warn("{}: dropping malformed measurement", getType(), e);
                return;
            }
            callbacks.onRangingData(data);
        }
    }

    private class ExecutorResultHandlers {
        final FutureCallback<Void> mStartRanging = new FutureCallback<>() {
            @Override
            public void onSuccess(Void v) {
                LOG.info("{}: start succeeded", getType());
                Callback callbacks = mCallbacks;
                if (callbacks != null) {
                    callbacks.onStarted();
                }
            }

            @Override
            public void onFailure(@NonNull Throwable t) {
                LOG.warn("{}: start failed", getType(), t);
                Callback callbacks = mCallbacks;
                if (callbacks != null) {
                    callbacks.onStopped(Callback.StoppedReason.ERROR);
                }
                clear();
            }
        };

        final FutureCallback<Object> mStopRanging = new FutureCallback<>() {
            @Override
            public void onSuccess(Object result) {
                Callback callbacks = mCallbacks;
                if (callbacks != null) {
                    callbacks.onStopped(Callback.StoppedReason.REQUESTED);
                }
                clear();
            }

            @Override
            public void onFailure(@NonNull Throwable t) {
                LOG.warn("{}: stop failed", getType(), t);
                // We failed to stop but there's nothing else we can do.
                Callback callbacks = mCallbacks;
                if (callbacks != null) {
                    callbacks.onStopped(Callback.StoppedReason.REQUESTED);
                }
                clear();
            }
        };
    }
}
