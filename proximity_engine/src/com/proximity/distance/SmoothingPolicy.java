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

/** Outlier rejection applied once a peer's window holds at least three samples. */
public enum SmoothingPolicy {
    /** Keep samples within two standard deviations, see {@link Smoothers.SigmaRejectionSmoother}. */
    SIGMA_REJECTION,
    /**
     * Drop the minimum and maximum, see {@link Smoothers.TrimmedMeanSmoother}. Always discards two
     * samples, even when the window holds no outlier.
     */
    TRIMMED_MEAN,
}
