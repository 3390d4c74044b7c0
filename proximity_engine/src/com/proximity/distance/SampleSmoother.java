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

import java.util.List;

/** Reduces a window of recent samples for one peer to a single smoothed value. */
public interface SampleSmoother {
    /**
     * Smooth the provided window.
     *
     * @param window of samples, oldest first. Never empty. <b>Implementations of this method must
     *               not mutate this parameter.</b>
     * @return the smoothed value.
     */
    double smooth(final @NonNull List<Double> window);
}
