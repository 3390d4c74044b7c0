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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.proximity.ranging.PreciseAdapter;
import com.proximity.ranging.RangingAdapter;
import com.proximity.ranging.RangingData;
import com.proximity.ranging.RangingException;
import com.proximity.ranging.RangingProvider;
import com.proximity.ranging.RangingTechnology;
import com.proximity.ranging.SignalStrengthAdapter;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

import java.time.Instant;
import java.util.concurrent.ExecutionException;

@RunWith(JUnit4.class)
public class RangingProviderTest {
    @Rule public final MockitoRule mMockito = MockitoJUnit.rule();

    @Mock private PreciseAdapter mMockPrecise;
    @Mock private SignalStrengthAdapter mMockSignalStrength;
    @Mock private RangingProvider.Callback mMockCallback;

    /** Class under test */
    private RangingProvider mProvider;

    @Before
    public void setUp() {
        when(mMockPrecise.getType()).thenReturn(RangingTechnology.PRECISE);
        when(mMockSignalStrength.getType()).thenReturn(RangingTechnology.SIGNAL_STRENGTH);
        setEnabled(mMockPrecise, true);
        setEnabled(mMockSignalStrength, true);
        mProvider = new RangingProvider(
                mMockPrecise, mMockSignalStrength, MoreExecutors.directExecutor());
    }

    private static void setEnabled(RangingAdapter adapter, boolean enabled) {
        when(adapter.isEnabled()).thenReturn(Futures.immediateFuture(enabled));
    }

    private static RangingAdapter.Callback captureStart(RangingAdapter adapter) {
        ArgumentCaptor<RangingAdapter.Callback> captor =
                ArgumentCaptor.forClass(RangingAdapter.Callback.class);
        verify(adapter).start(captor.capture());
        return captor.getValue();
    }

    private static RangingData preciseData(double meters) {
        return new RangingData.Builder()
                .setTechnology(RangingTechnology.PRECISE)
                .setPeerId("peer")
                .setRangeDistance(meters)
                .setTimestamp(Instant.EPOCH)
                .build();
    }

    private static RangingData signalStrengthData(int rssi) {
        return new RangingData.Builder()
                .setTechnology(RangingTechnology.SIGNAL_STRENGTH)
                .setRssi(rssi)
                .setTimestamp(Instant.EPOCH)
                .build();
    }

    @Test
    public void start_preciseAvailable_startsPrecise() {
        mProvider.start(mMockCallback);

        RangingAdapter.Callback preciseCallback = captureStart(mMockPrecise);
        preciseCallback.onStarted();

        verify(mMockCallback).onStarted(RangingTechnology.PRECISE);
        verify(mMockSignalStrength, never()).start(any());
        verify(mMockCallback, never()).onDegraded(any());
        assertThat(mProvider.isPreciseActive()).isTrue();
        assertThat(mProvider.getActiveTechnology()).hasValue(RangingTechnology.PRECISE);
    }

    @Test
    public void start_preciseUnavailable_fallsBackWithNotice() {
        setEnabled(mMockPrecise, false);

        mProvider.start(mMockCallback);
        captureStart(mMockSignalStrength).onStarted();

        verify(mMockPrecise, never()).start(any());
        InOrder inOrder = inOrder(mMockCallback);
        inOrder.verify(mMockCallback).onDegraded(RangingProvider.NOTICE_PRECISE_UNAVAILABLE);
        inOrder.verify(mMockCallback).onStarted(RangingTechnology.SIGNAL_STRENGTH);
        assertThat(mProvider.isPreciseActive()).isFalse();
    }

    @Test
    public void start_noPreciseAdapter_fallsBack() {
        mProvider = new RangingProvider(null, mMockSignalStrength, MoreExecutors.directExecutor());

        mProvider.start(mMockCallback);
        captureStart(mMockSignalStrength).onStarted();

        verify(mMockCallback).onDegraded(RangingProvider.NOTICE_PRECISE_UNAVAILABLE);
        verify(mMockCallback).onStarted(RangingTechnology.SIGNAL_STRENGTH);
    }

    @Test
    public void start_preciseFailsToStart_fallsBackWithoutLosingSession() {
        mProvider.start(mMockCallback);

        captureStart(mMockPrecise).onStopped(RangingAdapter.Callback.StoppedReason.ERROR);

        verify(mMockCallback, never()).onPreciseRangingLost();
        verify(mMockCallback).onDegraded(RangingProvider.NOTICE_PRECISE_FAILED);
        verify(mMockSignalStrength).start(any());
    }

    @Test
    public void start_noSourceAvailable_reportsUnavailable() {
        setEnabled(mMockPrecise, false);
        setEnabled(mMockSignalStrength, false);

        mProvider.start(mMockCallback);

        verify(mMockCallback).onUnavailable(RangingProvider.ERROR_NO_SOURCE);
        verify(mMockCallback, never()).onStarted(any());
        assertThat(mProvider.getActiveTechnology()).isEmpty();
    }

    @Test
    public void start_noAdapters_reportsUnavailable() {
        mProvider = new RangingProvider(null, null, MoreExecutors.directExecutor());

        mProvider.start(mMockCallback);

        verify(mMockCallback).onUnavailable(RangingProvider.ERROR_NO_SOURCE);
    }

    @Test
    public void preciseInvalidated_reportsLossThenFallsBack() {
        mProvider.start(mMockCallback);
        RangingAdapter.Callback preciseCallback = captureStart(mMockPrecise);
        preciseCallback.onStarted();
        preciseCallback.onLocalToken(new byte[]{4, 2});

        preciseCallback.onStopped(RangingAdapter.Callback.StoppedReason.ERROR);

        InOrder inOrder = inOrder(mMockCallback);
        inOrder.verify(mMockCallback).onPreciseRangingLost();
        inOrder.verify(mMockCallback).onDegraded(RangingProvider.NOTICE_PRECISE_FAILED);
        assertThat(mProvider.isPreciseActive()).isFalse();
        assertThat(mProvider.getLocalToken()).isEmpty();

        captureStart(mMockSignalStrength).onStarted();
        verify(mMockCallback).onStarted(RangingTechnology.SIGNAL_STRENGTH);
    }

    @Test
    public void signalStrengthStops_reportsUnavailable() {
        setEnabled(mMockPrecise, false);
        mProvider.start(mMockCallback);
        RangingAdapter.Callback callback = captureStart(mMockSignalStrength);
        callback.onStarted();

        callback.onStopped(RangingAdapter.Callback.StoppedReason.ERROR);

        verify(mMockCallback).onUnavailable(RangingProvider.ERROR_NO_SOURCE);
        assertThat(mProvider.getActiveTechnology()).isEmpty();
    }

    @Test
    public void rangingData_fromActiveSource_isForwarded() {
        mProvider.start(mMockCallback);
        RangingAdapter.Callback preciseCallback = captureStart(mMockPrecise);
        preciseCallback.onStarted();

        RangingData data = preciseData(2.0);
        preciseCallback.onRangingData(data);

        verify(mMockCallback).onRangingData(data);
    }

    @Test
    public void rangingData_fromInactiveSource_isDropped() {
        mProvider.start(mMockCallback);
        RangingAdapter.Callback preciseCallback = captureStart(mMockPrecise);
        preciseCallback.onStopped(RangingAdapter.Callback.StoppedReason.ERROR);
        RangingAdapter.Callback signalCallback = captureStart(mMockSignalStrength);
        signalCallback.onStarted();

        RangingData data = signalStrengthData(-60);
        RangingData stale = preciseData(1.0);
        signalCallback.onRangingData(data);
        preciseCallback.onRangingData(stale);

        verify(mMockCallback).onRangingData(data);
        verify(mMockCallback, never()).onRangingData(stale);
    }

    @Test
    public void localToken_isStoredAndReported() {
        mProvider.start(mMockCallback);
        RangingAdapter.Callback preciseCallback = captureStart(mMockPrecise);

        preciseCallback.onLocalToken(new byte[]{1, 2});

        verify(mMockCallback).onLocalToken(new byte[]{1, 2});
        assertThat(mProvider.getLocalToken().get()).isEqualTo(new byte[]{1, 2});
    }

    @Test
    public void configurePeer_preciseNotActive_fails() {
        setEnabled(mMockPrecise, false);
        mProvider.start(mMockCallback);

        ListenableFuture<Void> future = mProvider.configurePeer("peer", new byte[]{1});

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertThat(e).hasCauseThat().isInstanceOf(RangingException.class);
        verify(mMockPrecise, never()).configurePeer(any(), any());
    }

    @Test
    public void configurePeer_preciseActive_delegatesToAdapter() throws Exception {
        when(mMockPrecise.configurePeer(any(), any())).thenReturn(Futures.immediateFuture(null));
        mProvider.start(mMockCallback);
        captureStart(mMockPrecise).onStarted();

        mProvider.configurePeer("peer", new byte[]{1}).get();
        mProvider.removePeer("peer");

        verify(mMockPrecise).configurePeer("peer", new byte[]{1});
        verify(mMockPrecise).removePeer("peer");
    }

    @Test
    public void stop_stopsActiveAdapterAndIgnoresLateEvents() {
        mProvider.start(mMockCallback);
        RangingAdapter.Callback preciseCallback = captureStart(mMockPrecise);
        preciseCallback.onStarted();

        mProvider.stop();
        preciseCallback.onStopped(RangingAdapter.Callback.StoppedReason.REQUESTED);

        verify(mMockPrecise).stop();
        verify(mMockCallback, never()).onPreciseRangingLost();
        verify(mMockSignalStrength, never()).start(any());
        assertThat(mProvider.getActiveTechnology()).isEmpty();
    }
}
