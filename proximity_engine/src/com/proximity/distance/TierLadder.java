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

import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * Boundaries used to map a distance onto a {@link DistanceLevel}. Each boundary is the inclusive
 * lower edge of the next tier: a distance equal to {@code nearFrom} is {@link DistanceLevel#NEAR}.
 */
public enum TierLadder {
    /** Short-range ladder matched to the default volume curve (1 m to 10 m). */
    STANDARD(1.0, 3.0, 6.0, 10.0),
    /** Wider ladder for signal-strength-only deployments where estimates are coarser. */
    EXTENDED(1.0, 3.0, 10.0, 20.0);

    private final double mNearFrom;
    private final double mMediumFrom;
    private final double mFarFrom;
    private final double mVeryFarFrom;

    TierLadder(double nearFrom, double mediumFrom, double farFrom, double veryFarFrom) {
        mNearFrom = nearFrom;
        mMediumFrom = mediumFrom;
        mFarFrom = farFrom;
        mVeryFarFrom = veryFarFrom;
    }

    /** @return the tier for {@code distance}, or {@link DistanceLevel#UNKNOWN} if it is invalid. */
    public @NonNull DistanceLevel levelFor(double distance) {
        if (Double.isNaN(distance) || distance < 0) {
            return DistanceLevel.UNKNOWN;
        }
        if (distance < mNearFrom) {
            return DistanceLevel.IMMEDIATE;
        } else if (distance < mMediumFrom) {
            return DistanceLevel.NEAR;
        } else if (distance < mFarFrom) {
            return DistanceLevel.MEDIUM;
        } else if (distance < mVeryFarFrom) {
            return DistanceLevel.FAR;
        } else {
            return DistanceLevel.VERY_FAR;
        }
    }

    /** @return the distance at and above which peers are {@link DistanceLevel#VERY_FAR}. */
    public double getVeryFarThreshold() {
        return mVeryFarFrom;
    }
}
