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

package com.proximity.distance;

import com.google.common.annotations.VisibleForTesting;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

/**
 * Turns noisy measurements into a stable distance, a {@link DistanceLevel} and a volume.
 *
 * <p>Holds one bounded sample window per peer. Not thread-safe: callers confine it to a single
 * execution context.
 */
public class DistanceEstimator {
    /** Returned by {@link #rssiToDistance} for readings that cannot be real signal strengths. */
    public static final double INVALID_DISTANCE = 0.0;

    private final DistanceConfig mConfig;
    private final SampleSmoother mSmoother;
    private final Map<String, ArrayDeque<Double>> mWindows;

    public DistanceEstimator(@NonNull DistanceConfig config) {
        mConfig = config;
        mSmoother = Smoothers.forPolicy(config.getSmoothingPolicy());
        mWindows = new HashMap<>();
    }

    public @NonNull DistanceConfig getConfig() {
        return mConfig;
    }

    /**
     * Converts a signal strength reading into meters using the log-distance path loss model,
     * clamped to the configured range.
     *
     * @param rssi in dBm.
     * @return the distance, or {@link #INVALID_DISTANCE} if {@code rssi >= 0}.
     */
    public double rssiToDistance(int rssi) {
        if (rssi >= 0) {
            return INVALID_DISTANCE;
        }
        double distance = Math.pow(10.0,
                (mConfig.getMeasuredPower() - rssi) / (10.0 * mConfig.getPathLossExponent()));
        return Math.min(Math.max(distance, mConfig.getMinRangeMeters()),
                mConfig.getMaxRangeMeters());
    }

    /**
     * Appends a sample to the window of {@code peerId}, dropping the oldest one beyond the
     * configured window size.
     *
     * @return the smoothed value of the window.
     */
    public double addSample(@NonNull String peerId, double value) {
        ArrayDeque<Double> window = mWindows.computeIfAbsent(peerId, id -> new ArrayDeque<>());
        window.addLast(value);
        while (window.size() > mConfig.getSmoothingWindow()) {
            window.removeFirst();
        }
        return mSmoother.smooth(new ArrayList<>(window));
    }

    /** Discards the sample window of {@code peerId}, if any. */
    public void forget(@NonNull String peerId) {
        mWindows.remove(peerId);
    }

    /** @return the number of samples currently held for {@code peerId}. */
    @VisibleForTesting
    public int sampleCount(@NonNull String peerId) {
        ArrayDeque<Double> window = mWindows.get(peerId);
        return window == null ? 0 : window.size();
    }

    /** @return the tier of {@code distance} on the configured ladder. */
    public @NonNull DistanceLevel distanceLevel(double distance) {
        return mConfig.getTierLadder().levelFor(distance);
    }

    /** @return the volume for {@code distance} using the configured curve. */
    public double volumeForDistance(double distance) {
        return computeVolume(distance, mConfig.getMinDistance(), mConfig.getMaxDistance(),
                mConfig.getMinVolume(), mConfig.getMaxVolume());
    }

    /**
     * Maps a distance onto a volume with exponential decay between {@code minDistance} and
     * {@code maxDistance}, so that equal steps in distance produce equal perceived loudness steps.
     *
     * @throws IllegalArgumentException if the bounds are invalid.
     */
    public static double volumeForDistance(double distance, double minDistance,
            double maxDistance, double minVolume, double maxVolume) {
        DistanceConfig.checkVolumeBounds(minDistance, maxDistance, minVolume, maxVolume);
        return computeVolume(distance, minDistance, maxDistance, minVolume, maxVolume);
    }

    private static double computeVolume(double distance, double minDistance, double maxDistance,
            double minVolume, double maxVolume) {
        // NaN compares false everywhere and is treated like a peer at point blank.
        if (!(distance > minDistance)) {
            return maxVolume;
        }
        if (distance >= maxDistance) {
            return minVolume;
        }
        double k = Math.log(maxVolume / minVolume) / (maxDistance - minDistance);
        double volume = maxVolume * Math.exp(-k * (distance - minDistance));
        return Math.min(Math.max(volume, minVolume), maxVolume);
    }
}
