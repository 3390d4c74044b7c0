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

import com.proximity.ProximityUtils.StateMachine;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Application level state. Only the listed transitions are legal; any other request is logged and
 * ignored. ERROR is entered separately through {@link #fail}.
 */
public class AppStateMachine {
    private static final Logger LOG = LoggerFactory.getLogger(AppStateMachine.class);

    private static final ImmutableSetMultimap<AppState, AppState> LEGAL_TRANSITIONS =
            ImmutableSetMultimap.<AppState, AppState>builder()
                    .put(AppState.IDLE, AppState.DISCOVERING)
                    .put(AppState.DISCOVERING, AppState.CONNECTED)
                    .put(AppState.DISCOVERING, AppState.IDLE)
                    .put(AppState.CONNECTED, AppState.TRANSMITTING)
                    .put(AppState.CONNECTED, AppState.IDLE)
                    .put(AppState.TRANSMITTING, AppState.CONNECTED)
                    .put(AppState.ERROR, AppState.IDLE)
                    .build();

    /** Notified after every change of state. */
    public interface Listener {
        void onStateChanged(@NonNull AppState state, @Nullable String errorMessage);
    }

    private final StateMachine<AppState> mStateMachine;
    private final Listener mListener;
    private volatile @Nullable String mErrorMessage;

    public AppStateMachine(@NonNull Listener listener) {
        mStateMachine = new StateMachine<>(AppState.IDLE);
        mListener = listener;
        mErrorMessage = null;
    }

    public @NonNull AppState getState() {
        return mStateMachine.getState();
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(mErrorMessage);
    }

    /** @return true if the state machine is in {@code state}. */
    public boolean isIn(@NonNull AppState state) {
        return mStateMachine.getState() == state;
    }

    /**
     * Move to {@code to} if that transition is legal from the current state.
     *
     * @return true if the state changed.
     */
    @CanIgnoreReturnValue
    public boolean transition(@NonNull AppState to) {
        AppState from = mStateMachine.getState();
        if (!LEGAL_TRANSITIONS.containsEntry(from, to)) {
            LOG.warn("Ignoring illegal transition {} -> {}", from, to);
            return false;
        }
        if (!mStateMachine.transition(from, to)) {
            LOG.warn("State changed concurrently, ignoring {} -> {}", from, to);
            return false;
        }
        if (from == AppState.ERROR || to == AppState.DISCOVERING) {
            mErrorMessage = null;
        }
        LOG.info("{} -> {}", from, to);
        mListener.onStateChanged(to, mErrorMessage);
        return true;
    }

    /**
     * Enter ERROR with a description of the cause. Refused while a paired peer is connected.
     *
     * @return true if the state machine entered ERROR.
     */
    @CanIgnoreReturnValue
    public boolean fail(@NonNull String message, boolean pairedPeerConnected) {
        Preconditions.checkArgument(!message.isEmpty(), "Error message must not be empty");
        if (pairedPeerConnected) {
            LOG.warn("Not entering ERROR while a paired peer is connected: {}", message);
            return false;
        }
        AppState from = mStateMachine.getState();
        mStateMachine.setState(AppState.ERROR);
        mErrorMessage = message;
        LOG.error("{} -> ERROR: {}", from, message);
        mListener.onStateChanged(AppState.ERROR, message);
        return true;
    }
}
