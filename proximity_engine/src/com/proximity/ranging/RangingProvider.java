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

import static com.google.common.util.concurrent.Futures.immediateFailedFuture;

import com.proximity.ProximityUtils.StateMachine;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Presents the precise and signal strength sources as one ranging capability. Precise ranging is
 * preferred; signal strength is the fallback whenever precise ranging is missing, fails to start,
 * or stops on its own.
 *
 * <p>Every adapter event is re-posted onto the callback executor before it touches provider state,
 * so the provider is confined to that executor.
 */
public class RangingProvider {
    private static final Logger LOG = LoggerFactory.getLogger(RangingProvider.class);

    public static final String NOTICE_PRECISE_UNAVAILABLE =
            "Precise ranging unavailable, using signal strength. Distances are approximate.";
    public static final String NOTICE_PRECISE_FAILED =
            "Precise ranging failed, using signal strength. Distances are approximate.";
    public static final String ERROR_NO_SOURCE = "No ranging source is available";

    /** Callbacks for provider events, invoked on the callback executor. */
    public interface Callback {
        /** A source started producing data. */
        void onStarted(@NonNull RangingTechnology technology);

        /** Ranging continues with reduced accuracy. Not fatal. */
        void onDegraded(@NonNull String notice);

        /** No ranging source could be started. */
        void onUnavailable(@NonNull String message);

        /** A measurement arrived from the active source. */
        void onRangingData(@NonNull RangingData data);

        /** The precise source published the token peers need to target this device. */
        void onLocalToken(byte @NonNull [] token);

        /** Precise ranging stopped after having started; peer sessions are gone. */
        void onPreciseRangingLost();
    }

    private enum State {
        STOPPED,
        STARTING,
        STARTED,
    }

    private final @Nullable StatefulAdapter<PreciseAdapter> mPrecise;
    private final @Nullable StatefulAdapter<SignalStrengthAdapter> mSignalStrength;
    private final Executor mCallbackExecutor;
    private final StateMachine<State> mStateMachine;

    private @Nullable Callback mCallback;
    private @Nullable RangingTechnology mActiveTechnology;
    private byte @Nullable [] mLocalToken;

    /**
     * @param precise          adapter, or null if the device has no ranging hardware.
     * @param signalStrength   adapter, or null if the device has no signal strength source.
     * @param callbackExecutor single-writer executor that owns this provider.
     */
    public RangingProvider(
            @Nullable PreciseAdapter precise,
            @Nullable SignalStrengthAdapter signalStrength,
            @NonNull Executor callbackExecutor
    ) {
        mPrecise = precise == null ? null : new StatefulAdapter<>(precise);
        mSignalStrength = signalStrength == null ? null : new StatefulAdapter<>(signalStrength);
        mCallbackExecutor = callbackExecutor;
        mStateMachine = new StateMachine<>(State.STOPPED);
        mCallback = null;
        mActiveTechnology = null;
        mLocalToken = null;
    }

    /** Check which sources are available and start the best available one. */
    public void start(@NonNull Callback callback) {
        if (!mStateMachine.transition(State.STOPPED, State.STARTING)) {
            LOG.warn("Failed transition STOPPED -> STARTING");
            return;
        }
        LOG.info("Starting ranging provider");
        mCallback = callback;

        if (mPrecise == null) {
            fallBack(NOTICE_PRECISE_UNAVAILABLE);
            return;
        }
        Futures.addCallback(mPrecise.isEnabled(), new FutureCallback<>() {
            @Override
            public void onSuccess(Boolean enabled) {
                if (mStateMachine.getState() == State.STOPPED) {
                    return;
                }
                if (Boolean.TRUE.equals(enabled)) {
                    mPrecise.start(new AdapterListener(RangingTechnology.PRECISE));
                } else {
                    LOG.info("Precise ranging is not available");
                    fallBack(NOTICE_PRECISE_UNAVAILABLE);
                }
            }

            @Override
            public void onFailure(@NonNull Throwable t) {
                LOG.warn("Failed to query precise ranging availability", t);
                if (mStateMachine.getState() != State.STOPPED) {
                    fallBack(NOTICE_PRECISE_UNAVAILABLE);
                }
            }
        }, mCallbackExecutor);
    }

    /** Stop whichever source is running. */
    public void stop() {
        if (mStateMachine.getState() == State.STOPPED) {
            LOG.debug("Ranging provider already stopped, skipping");
            return;
        }
        LOG.info("Stopping ranging provider");
        mStateMachine.setState(State.STOPPED);
        if (mPrecise != null && mPrecise.getState() != StatefulAdapter.State.STOPPED) {
            mPrecise.stop();
        }
        if (mSignalStrength != null
                && mSignalStrength.getState() != StatefulAdapter.State.STOPPED) {
            mSignalStrength.stop();
        }
        mActiveTechnology = null;
        mLocalToken = null;
        mCallback = null;
    }

    /** @return the technology currently producing data, if any. */
    public Optional<RangingTechnology> getActiveTechnology() {
        return Optional.ofNullable(mActiveTechnology);
    }

    /** @return true if precise ranging is running. */
    public boolean isPreciseActive() {
        return mActiveTechnology == RangingTechnology.PRECISE;
    }

    /** @return the local precise ranging token, once the precise source has published one. */
    public Optional<byte[]> getLocalToken() {
        return Optional.ofNullable(mLocalToken).map(byte[]::clone);
    }

    /**
     * Begin precise ranging with a peer using the token it sent us.
     *
     * @return a future that fails with {@link RangingException} if precise ranging is not active
     * or the source rejects the token.
     */
    public ListenableFuture<Void> configurePeer(@NonNull String peerId, byte @NonNull [] token) {
        if (mPrecise == null || !isPreciseActive()) {
            return immediateFailedFuture(new RangingException("Precise ranging is not active"));
        }
        return mPrecise.getAdapter().configurePeer(peerId, token);
    }

    /** Stop precise ranging with a peer. Does nothing unless precise ranging is active. */
    public void removePeer(@NonNull String peerId) {
        if (mPrecise != null && isPreciseActive()) {
            mPrecise.getAdapter().removePeer(peerId);
        }
    }

    private void fallBack(String notice) {
        if (mSignalStrength == null) {
            fail();
            return;
        }
        Futures.addCallback(mSignalStrength.isEnabled(), new FutureCallback<>() {
            @Override
            public void onSuccess(Boolean enabled) {
                if (mStateMachine.getState() == State.STOPPED) {
                    return;
                }
                if (Boolean.TRUE.equals(enabled)) {
                    LOG.warn("Falling back to signal strength ranging: {}", notice);
                    mCallback.onDegraded(notice);
                    mSignalStrength.start(new AdapterListener(RangingTechnology.SIGNAL_STRENGTH));
                } else {
                    fail();
                }
            }

            @Override
            public void onFailure(@NonNull Throwable t) {
                LOG.warn("Failed to query signal strength availability", t);
                if (mStateMachine.getState() != State.STOPPED) {
                    fail();
                }
            }
        }, mCallbackExecutor);
    }

    private void fail() {
        LOG.error("{}", ERROR_NO_SOURCE);
        Callback callback = mCallback;
        mStateMachine.setState(State.STOPPED);
        mActiveTechnology = null;
        mCallback = null;
        if (callback != null) {
            callback.onUnavailable(ERROR_NO_SOURCE);
        }
    }

    private void handleStarted(RangingTechnology technology) {
        if (mStateMachine.getState() == State.STOPPED) {
            LOG.warn("Received adapter onStarted but ranging provider is stopped");
            return;
        }
        LOG.info("{} ranging started", technology);
        mStateMachine.setState(State.STARTED);
        mActiveTechnology = technology;
        mCallback.onStarted(technology);
    }

    private void handleStopped(
            RangingTechnology technology, RangingAdapter.Callback.StoppedReason reason) {
        if (mStateMachine.getState() == State.STOPPED) {
            return;
        }
        LOG.info("{} ranging stopped: {}", technology, reason);
        boolean wasActive = mActiveTechnology == technology;
        if (wasActive) {
            mActiveTechnology = null;
        }
        if (technology == RangingTechnology.PRECISE) {
            mLocalToken = null;
            if (wasActive) {
                mCallback.onPreciseRangingLost();
            }
            fallBack(NOTICE_PRECISE_FAILED);
        } else {
            fail();
        }
    }

    private void handleRangingData(RangingTechnology technology, RangingData data) {
        if (mStateMachine.getState() == State.STOPPED || mActiveTechnology != technology) {
            return;
        }
        mCallback.onRangingData(data);
    }

    private void handleLocalToken(byte[] token) {
        if (mStateMachine.getState() == State.STOPPED) {
            return;
        }
        mLocalToken = token.clone();
        mCallback.onLocalToken(token.clone());
    }

    /* Listener implementation for ranging adapter callback. */
    private class AdapterListener implements RangingAdapter.Callback {
        private final RangingTechnology mTechnology;

        AdapterListener(RangingTechnology technology) {
            mTechnology = technology;
        }

        @Override
        public void onStarted() {
            mCallbackExecutor.execute(() -> handleStarted(mTechnology));
        }

        @Override
        public void onStopped(StoppedReason reason) {
            mCallbackExecutor.execute(() -> handleStopped(mTechnology, reason));
        }

        @Override
        public void onRangingData(RangingData rangingData) {
            mCallbackExecutor.execute(() -> handleRangingData(mTechnology, rangingData));
        }

        @Override
        public void onLocalToken(byte[] token) {
            mCallbackExecutor.execute(() -> handleLocalToken(token));
        }
    }
}
