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

package com.proximity.ranging.tests;

import static com.google.common.truth.Truth.assertThat;

import static org.junit.Assert.assertThrows;

import com.proximity.ranging.RangingData;
import com.proximity.ranging.RangingTechnology;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.time.Instant;

@RunWith(JUnit4.class)
public class RangingDataTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    public void precise_rawValueIsMeters() {
        RangingData data = new RangingData.Builder()
                .setTechnology(RangingTechnology.PRECISE)
                .setPeerId("peer")
                .setRangeDistance(2.5)
                .setAzimuthRadians(0.3)
                .setTimestamp(NOW)
                .build();

        assertThat(data.getRawValue()).isEqualTo(2.5);
        assertThat(data.getPeerId()).hasValue("peer");
        assertThat(data.getRssi().isPresent()).isFalse();
        assertThat(data.getAzimuthRadians().getAsDouble()).isEqualTo(0.3);
        assertThat(data.getElevationRadians().isPresent()).isFalse();
    }

    @Test
    public void signalStrength_rawValueIsRssi() {
        RangingData data = new RangingData.Builder()
                .setTechnology(RangingTechnology.SIGNAL_STRENGTH)
                .setRssi(-70)
                .setTimestamp(NOW)
                .build();

        assertThat(data.getRawValue()).isEqualTo(-70.0);
        assertThat(data.getPeerId()).isEmpty();
        assertThat(data.getRangeMeters().isPresent()).isFalse();
    }

    @Test
    public void build_requiresTechnologyAndTimestamp() {
        assertThrows(IllegalArgumentException.class,
                () -> new RangingData.Builder().setRssi(-60).setTimestamp(NOW).build());
        assertThrows(IllegalArgumentException.class,
                () -> new RangingData.Builder()
                        .setTechnology(RangingTechnology.SIGNAL_STRENGTH)
                        .setRssi(-60)
                        .build());
    }

    @Test
    public void build_requiresValueForTechnology() {
        assertThrows(IllegalArgumentException.class,
                () -> new RangingData.Builder()
                        .setTechnology(RangingTechnology.PRECISE)
                        .setRssi(-60)
                        .setTimestamp(NOW)
                        .build());
        assertThrows(IllegalArgumentException.class,
                () -> new RangingData.Builder()
                        .setTechnology(RangingTechnology.SIGNAL_STRENGTH)
                        .setRangeDistance(1.0)
                        .setTimestamp(NOW)
                        .build());
    }
}
