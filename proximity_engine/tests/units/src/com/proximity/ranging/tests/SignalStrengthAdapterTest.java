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

import static org.mockito.Mockito.verify;

import com.proximity.ranging.RangingAdapter;
import com.proximity.ranging.RangingData;
import com.proximity.ranging.RangingSource;
import com.proximity.ranging.RangingTechnology;
import com.proximity.ranging.SignalStrengthAdapter;
import com.proximity.testing.FakeClock;

import com.google.common.util.concurrent.MoreExecutors;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class SignalStrengthAdapterTest {
    @Rule public final MockitoRule mMockito = MockitoJUnit.rule();

    @Mock private RangingSource mMockSource;
    @Mock private RangingAdapter.Callback mMockCallback;

    /** Class under test */
    private SignalStrengthAdapter mAdapter;

    @Before
    public void setUp() {
        mAdapter = new SignalStrengthAdapter(
                mMockSource, MoreExecutors.newDirectExecutorService(), new FakeClock());
    }

    @Test
    public void getType_returnsSignalStrength() {
        assertThat(mAdapter.getType()).isEqualTo(RangingTechnology.SIGNAL_STRENGTH);
    }

    @Test
    public void measurement_isReportedAsRssi() {
        mAdapter.start(mMockCallback);

        mAdapter.getListener().onMeasurement(null, -64.4);

        ArgumentCaptor<RangingData> dataCaptor = ArgumentCaptor.forClass(RangingData.class);
        verify(mMockCallback).onRangingData(dataCaptor.capture());
        assertThat(dataCaptor.getValue().getTechnology())
                .isEqualTo(RangingTechnology.SIGNAL_STRENGTH);
        assertThat(dataCaptor.getValue().getRssi().getAsInt()).isEqualTo(-64);
        assertThat(dataCaptor.getValue().getPeerId()).isEmpty();
    }
}
