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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/**
 * Tunables of the {@link DistanceEstimator}. Every instance has been validated: invalid bounds are
 * rejected by {@link Builder#build()} and never reach the estimator.
 */
@AutoValue
public abstract class DistanceConfig {

    /** Returns the reference signal strength at 1 m, in dBm. */
    public abstract double getMeasuredPower();

    /** Returns the path loss exponent: 2.0 in free space, higher indoors. */
    public abstract double getPathLossExponent();

    /** Returns the smallest distance {@link DistanceEstimator#rssiToDistance} reports. */
    public abstract double getMinRangeMeters();

    /** Returns the largest distance {@link DistanceEstimator#rssiToDistance} reports. */
    public abstract double getMaxRangeMeters();

    /** Returns the distance at or below which volume is {@link #getMaxVolume()}. */
    public abstract double getMinDistance();

    /** Returns the distance at or above which volume is {@link #getMinVolume()}. */
    public abstract double getMaxDistance();

    public abstract double getMinVolume();

    public abstract double getMaxVolume();

    /** Returns how many recent samples are kept per peer. */
    public abstract int getSmoothingWindow();

    public abstract SmoothingPolicy getSmoothingPolicy();

    public abstract TierLadder getTierLadder();

    /** Returns a builder populated with the default configuration. */
    public static Builder builder() {
        return new AutoValue_DistanceConfig.Builder()
                .setMeasuredPower(-50.0)
                .setPathLossExponent(2.0)
                .setMinRangeMeters(0.1)
                .setMaxRangeMeters(100.0)
                .setMinDistance(1.0)
                .setMaxDistance(10.0)
                .setMinVolume(0.1)
                .setMaxVolume(1.0)
                .setSmoothingWindow(5)
                .setSmoothingPolicy(SmoothingPolicy.SIGMA_REJECTION)
                .setTierLadder(TierLadder.STANDARD);
    }

    /** Returns the default configuration. */
    public static DistanceConfig defaults() {
        return builder().build();
    }

    public abstract Builder toBuilder();

    /** Builder for {@link DistanceConfig}. */
    @AutoValue.Builder
    public abstract static class Builder {
        public abstract Builder setMeasuredPower(double measuredPower);

        public abstract Builder setPathLossExponent(double pathLossExponent);

        public abstract Builder setMinRangeMeters(double minRangeMeters);

        public abstract Builder setMaxRangeMeters(double maxRangeMeters);

        public abstract Builder setMinDistance(double minDistance);

        public abstract Builder setMaxDistance(double maxDistance);

        public abstract Builder setMinVolume(double minVolume);

        public abstract Builder setMaxVolume(double maxVolume);

        public abstract Builder setSmoothingWindow(int smoothingWindow);

        public abstract Builder setSmoothingPolicy(SmoothingPolicy smoothingPolicy);

        public abstract Builder setTierLadder(TierLadder tierLadder);

        abstract DistanceConfig autoBuild();

        /**
         * Builds the configuration.
         *
         * @throws IllegalArgumentException if any bound is invalid.
         */
        public DistanceConfig build() {
            DistanceConfig config = autoBuild();
            checkVolumeBounds(config.getMinDistance(), config.getMaxDistance(),
                    config.getMinVolume(), config.getMaxVolume());
            Preconditions.checkArgument(config.getPathLossExponent() > 0,
                    "pathLossExponent must be positive but was %s",
                    config.getPathLossExponent());
            Preconditions.checkArgument(
                    config.getMinRangeMeters() >= 0
                            && config.getMinRangeMeters() < config.getMaxRangeMeters(),
                    "range clamp [%s, %s] is invalid",
                    config.getMinRangeMeters(), config.getMaxRangeMeters());
            Preconditions.checkArgument(config.getSmoothingWindow() >= 1,
                    "smoothingWindow must be at least 1 but was %s",
                    config.getSmoothingWindow());
            return config;
        }
    }

    /**
     * Validates a set of volume curve bounds.
     *
     * @throws IllegalArgumentException if the bounds cannot produce a finite volume curve.
     */
    static void checkVolumeBounds(
            double minDistance, double maxDistance, double minVolume, double maxVolume) {
        Preconditions.checkArgument(Double.isFinite(minDistance) && Double.isFinite(maxDistance),
                "distance bounds must be finite");
        Preconditions.checkArgument(maxDistance > minDistance,
                "maxDistance (%s) must be greater than minDistance (%s)", maxDistance, minDistance);
        Preconditions.checkArgument(minVolume > 0,
                "minVolume must be positive but was %s", minVolume);
        Preconditions.checkArgument(maxVolume >= minVolume && maxVolume <= 1.0,
                "maxVolume (%s) must be within [minVolume, 1.0]", maxVolume);
    }
}
