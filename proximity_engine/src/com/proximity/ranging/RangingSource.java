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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Boundary to a ranging capability implemented outside this engine, such as a radio stack. Methods
 * may be called from any thread and listener methods may be invoked on any thread.
 */
public interface RangingSource {

    /** @return true if the capability exists and is currently usable on this device. */
    boolean isAvailable();

    /**
     * Start producing measurements.
     *
     * @param listener to notify of measurements and lifecycle events.
     * @throws RangingException if the source cannot start, e.g. for lack of hardware or
     *                          permission.
     */
    void start(@NonNull Listener listener) throws RangingException;

    /** Stop producing measurements. Does nothing if the source is not started. */
    void stop();

    /** Receives measurements and lifecycle events from a {@link RangingSource}. */
    interface Listener {
        /**
         * Called for each measurement.
         *
         * @param peerId the measurement refers to, or {@code null} if the source cannot tell.
         * @param value  meters for precise sources, dBm for signal strength sources.
         */
        void onMeasurement(@Nullable String peerId, double value);

        /**
         * Called for each measurement that also carries a direction. Sources without direction
         * finding never call this.
         */
        default void onMeasurement(@Nullable String peerId, double value, double azimuthRadians,
                double elevationRadians) {
            onMeasurement(peerId, value);
        }

        /** Called once the source has a local ranging token that peers need to target it. */
        default void onLocalToken(byte @NonNull [] token) {
        }

        /** Called when the source stops on its own, e.g. after a hardware failure. */
        void onInvalidated(@NonNull Throwable cause);
    }
}
