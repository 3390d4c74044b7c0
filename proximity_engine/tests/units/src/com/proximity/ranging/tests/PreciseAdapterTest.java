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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.proximity.ranging.PreciseAdapter;
import com.proximity.ranging.PreciseRangingSource;
import com.proximity.ranging.RangingAdapter;
import com.proximity.ranging.RangingData;
import com.proximity.ranging.RangingException;
import com.proximity.ranging.RangingTechnology;
import com.proximity.testing.FakeClock;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

import java.util.concurrent.ExecutionException;

@RunWith(JUnit4.class)
public class PreciseAdapterTest {
    @Rule public final MockitoRule mMockito = MockitoJUnit.rule();

    @Mock private PreciseRangingSource mMockSource;
    @Mock private RangingAdapter.Callback mMockCallback;

    private final FakeClock mClock = new FakeClock();

    /** Class under test */
    private PreciseAdapter mPreciseAdapter;

    @Before
    public void setUp() {
        mPreciseAdapter = new PreciseAdapter(
                mMockSource, MoreExecutors.newDirectExecutorService(), mClock);
    }

    @Test
    public void getType_returnsPrecise() {
        Assert.assertEquals(RangingTechnology.PRECISE, mPreciseAdapter.getType());
    }

    @Test
    public void isEnabled_checksSourceIsAvailable()
            throws InterruptedException, ExecutionException {
        when(mMockSource.isAvailable()).thenReturn(true);
        Assert.assertTrue(mPreciseAdapter.isEnabled().get());
    }

    @Test
    public void start_startsSourceWithListener() throws RangingException {
        mPreciseAdapter.start(mMockCallback);

        verify(mMockSource).start(any());
        verify(mMockCallback).onStarted();
    }

    @Test
    public void start_failure_reportsError() throws RangingException {
        doThrow(new RangingException("no permission")).when(mMockSource).start(any());

        mPreciseAdapter.start(mMockCallback);

        verify(mMockCallback).onStopped(eq(RangingAdapter.Callback.StoppedReason.ERROR));
        verify(mMockCallback, never()).onStarted();
    }

    @Test
    public void listener_forwardsMeasurementsAndToken() {
        mPreciseAdapter.start(mMockCallback);

        mPreciseAdapter.getListener().onMeasurement("peer", 1.5, 0.1, -0.2);
        mPreciseAdapter.getListener().onLocalToken(new byte[]{1, 2, 3});

        ArgumentCaptor<RangingData> dataCaptor = ArgumentCaptor.forClass(RangingData.class);
        verify(mMockCallback).onRangingData(dataCaptor.capture());
        RangingData data = dataCaptor.getValue();
        assertThat(data.getTechnology()).isEqualTo(RangingTechnology.PRECISE);
        assertThat(data.getPeerId()).hasValue("peer");
        assertThat(data.getRangeMeters().getAsDouble()).isEqualTo(1.5);
        assertThat(data.getAzimuthRadians().getAsDouble()).isEqualTo(0.1);
        assertThat(data.getTimestamp()).isEqualTo(mClock.instant());
        verify(mMockCallback).onLocalToken(eq(new byte[]{1, 2, 3}));
    }

    @Test
    public void listener_invalidation_reportsError() {
        mPreciseAdapter.start(mMockCallback);

        mPreciseAdapter.getListener().onInvalidated(new IllegalStateException("radio off"));
        mPreciseAdapter.getListener().onMeasurement("peer", 1.0);

        verify(mMockCallback).onStopped(eq(RangingAdapter.Callback.StoppedReason.ERROR));
        verify(mMockCallback, never()).onRangingData(any());
    }

    @Test
    public void stop_stopsSource() {
        mPreciseAdapter.start(mMockCallback);
        mPreciseAdapter.stop();

        verify(mMockSource).stop();
        verify(mMockCallback).onStopped(eq(RangingAdapter.Callback.StoppedReason.REQUESTED));
    }

    @Test
    public void configurePeer_passesTokenToSource() throws Exception {
        byte[] token = {9, 8, 7};

        mPreciseAdapter.configurePeer("peer", token).get();

        verify(mMockSource).configurePeer(eq("peer"), eq(token));
    }

    @Test
    public void configurePeer_rejectedToken_failsFuture() throws Exception {
        doThrow(new RangingException("bad token"))
                .when(mMockSource).configurePeer(any(), any());

        ListenableFuture<Void> future = mPreciseAdapter.configurePeer("peer", new byte[]{1});

        ExecutionException e = Assert.assertThrows(ExecutionException.class, future::get);
        assertThat(e).hasCauseThat().isInstanceOf(RangingException.class);
    }

    @Test
    public void removePeer_removesFromSource() {
        mPreciseAdapter.removePeer("peer");
        verify(mMockSource).removePeer("peer");
    }
}
