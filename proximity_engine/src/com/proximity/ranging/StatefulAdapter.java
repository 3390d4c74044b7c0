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

import com.proximity.ProximityUtils;

import com.google.common.util.concurrent.ListenableFuture;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wraps a {@link RangingAdapter} and drops callbacks that do not match its lifecycle. */
public class StatefulAdapter<A extends RangingAdapter> implements RangingAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(StatefulAdapter.class);

    private final A mAdapter;
    private final ProximityUtils.StateMachine<State> mStateMachine;

    /** State of the adapter. */
    public enum State {
        STOPPING,
        STOPPED,
        STARTING,
        STARTED,
    }

    public StatefulAdapter(A adapter) {
        mAdapter = adapter;
        mStateMachine = new ProximityUtils.StateMachine<>(State.STOPPED);
    }

    /** @return the state of the adapter */
    @NonNull
    public State getState() {
        return mStateMachine.getState();
    }

    /** @return the wrapped adapter. */
    public A getAdapter() {
        return mAdapter;
    }

    @Override
    public RangingTechnology getType() {
        return mAdapter.getType();
    }

    @Override
    public ListenableFuture<Boolean> isEnabled() {
        return mAdapter.isEnabled();
    }

    @Override
    public void start(Callback callback) {
        if (mStateMachine.transition(State.STOPPED, State.STARTING)) {
            mAdapter.start(new StateChangeWrapper(callback));
        } else {
            LOG.warn("{}: failed transition STOPPED -> STARTING: not in STOPPED", getType());
        }
    }

    @Override
    public void stop() {
        if (mStateMachine.transition(State.STARTED, State.STOPPING)
                || mStateMachine.transition(State.STARTING, State.STOPPING)) {
            mAdapter.stop();
        } else {
            LOG.warn("{}: failed transition -> STOPPING: not started", getType());
        }
    }

    private class StateChangeWrapper implements Callback {
        private final Callback mCallbacks;

        StateChangeWrapper(Callback callbacks) {
            mCallbacks = callbacks;
        }

        @Override
        public void onStarted() {
            if (mStateMachine.transition(State.STARTING, State.STARTED)) {
                mCallbacks.onStarted();
            } else {
                LOG.error("{}: failed transition STARTING -> STARTED: not in STARTING", getType());
            }
        }

        @Override
        public void onStopped(StoppedReason reason) {
            State previous = mStateMachine.getState();
            if (previous == State.STOPPED) {
                LOG.error("{}: received onStopped but already STOPPED", getType());
                return;
            }
            mStateMachine.setState(State.STOPPED);
            mCallbacks.onStopped(reason);
        }

        @Override
        public void onRangingData(RangingData rangingData) {
            if (mStateMachine.getState() == State.STARTED) {
                mCallbacks.onRangingData(rangingData);
            } else {
                LOG.error("{}: received ranging data but not in STARTED", getType());
            }
        }

        @Override
        public void onLocalToken(byte[] token) {
            State state = mStateMachine.getState();
            if (state == State.STARTING || state == State.STARTED) {
                mCallbacks.onLocalToken(token);
            } else {
                LOG.error("{}: received local token while {}", getType(), state);
            }
        }
    }
}
