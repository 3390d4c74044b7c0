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

import com.google.common.util.concurrent.ListeningExecutorService;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.time.Clock;

/** Ranging adapter for signal strength inference. Measurements are reported in dBm. */
public class SignalStrengthAdapter extends SourceAdapter<RangingSource> {

    public SignalStrengthAdapter(@NonNull RangingSource source,
            @NonNull ListeningExecutorService executorService, @NonNull Clock clock) {
        super(source, executorService, clock);
    }

    @Override
    public RangingTechnology getType() {
        return RangingTechnology.SIGNAL_STRENGTH;
    }

    @Override
    protected RangingData.Builder newRangingData(double value) {
        return new RangingData.Builder()
                .setTechnology(RangingTechnology.SIGNAL_STRENGTH)
                .setRssi((int) Math.round(value));
    }
}
