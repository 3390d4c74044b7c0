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

package com.proximity.token.tests;

import static com.google.common.truth.Truth.assertThat;

import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.proximity.distance.DistanceConfig;
import com.proximity.distance.DistanceEstimator;
import com.proximity.message.MessageSender;
import com.proximity.message.PeerMessage;
import com.proximity.message.PeerMessageCodec;
import com.proximity.message.PeerMessageType;
import com.proximity.peer.PeerRegistry;
import com.proximity.ranging.RangingException;
import com.proximity.ranging.RangingProvider;
import com.proximity.ranging.RangingTechnology;
import com.proximity.ranging.fusion.DataFusers;
import com.proximity.testing.FakeClock;
import com.proximity.testing.FakeScheduledExecutorService;
import com.proximity.token.TokenExchangeProtocol;
import com.proximity.token.TokenExchangeState;
import com.proximity.transport.TransportException;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@RunWith(JUnit4.class)
public class TokenExchangeProtocolTest {
    private static final byte[] LOCAL_TOKEN = {1, 2, 3};
    private static final byte[] PEER_TOKEN = {7, 8, 9};

    @Rule public final MockitoRule mMockito = MockitoJUnit.rule();

    @Mock private RangingProvider mMockRangingProvider;
    @Mock private MessageSender mMockSender;
    @Mock private PeerRegistry.Listener mMockRegistryListener;
    @Mock private TokenExchangeProtocol.Listener mMockListener;

    private final FakeClock mClock = new FakeClock();
    private final FakeScheduledExecutorService mExecutor = new FakeScheduledExecutorService(mClock);
    private PeerRegistry mRegistry;

    /** Class under test */
    private TokenExchangeProtocol mExchange;

    @Before
    public void setUp() {
        mRegistry = new PeerRegistry(new DistanceEstimator(DistanceConfig.defaults()),
                new DataFusers.PreferentialDataFuser(RangingTechnology.PRECISE), mClock,
                PeerRegistry.DEFAULT_STALE_TIMEOUT, mMockRegistryListener);
        mExchange = new TokenExchangeProtocol(mRegistry, mMockRangingProvider, mMockSender,
                mExecutor, TokenExchangeProtocol.DEFAULT_TIMEOUT, "Local", mMockListener);
        mRegistry.markConnected("a");
        when(mMockRangingProvider.configurePeer(anyString(), any()))
                .thenReturn(Futures.immediateFuture(null));
        setPreciseActive(true);
    }

    private void setPreciseActive(boolean active) {
        when(mMockRangingProvider.isPreciseActive()).thenReturn(active);
        when(mMockRangingProvider.getLocalToken())
                .thenReturn(active ? Optional.of(LOCAL_TOKEN.clone()) : Optional.empty());
    }

    private static PeerMessage tokenMessage(String encoded) {
        return PeerMessage.create(PeerMessageType.DISCOVERY_TOKEN, Instant.EPOCH,
                ImmutableMap.of(PeerMessage.Keys.TOKEN, encoded, PeerMessage.Keys.SENDER, "A"));
    }

    private static PeerMessage tokenMessage(byte[] token) {
        return tokenMessage(PeerMessageCodec.encodeBinary(token));
    }

    private boolean isPreciseRangingActive(String peerId) {
        return mRegistry.get(peerId).orElseThrow().isPreciseRangingActive();
    }

    @Test
    public void initiate_sendsTokenAndWaits() throws Exception {
        assertThat(mExchange.initiate("a")).isTrue();

        verify(mMockSender).send("a", PeerMessageType.DISCOVERY_TOKEN, ImmutableMap.of(
                PeerMessage.Keys.TOKEN, PeerMessageCodec.encodeBinary(LOCAL_TOKEN),
                PeerMessage.Keys.SENDER, "Local"));
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.WAITING);
        assertThat(mExchange.hasPendingTimeout("a")).isTrue();
    }

    @Test
    public void initiate_preciseInactive_doesNothing() throws Exception {
        setPreciseActive(false);

        assertThat(mExchange.initiate("a")).isFalse();

        verify(mMockSender, never()).send(anyString(), any(), anyMap());
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.IDLE);
    }

    @Test
    public void initiate_notIdle_doesNothing() throws Exception {
        mExchange.initiate("a");

        assertThat(mExchange.initiate("a")).isFalse();
    }

    @Test
    public void initiate_sendFails_staysIdle() throws Exception {
        doThrow(new TransportException("link down")).when(mMockSender)
                .send(eq("a"), eq(PeerMessageType.DISCOVERY_TOKEN), anyMap());

        assertThrows(TransportException.class, () -> mExchange.initiate("a"));

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.IDLE);
        assertThat(mExchange.hasPendingTimeout("a")).isFalse();
    }

    @Test
    public void waiting_timesOutToIdle() throws Exception {
        mExchange.initiate("a");

        mExecutor.advance(Duration.ofSeconds(9));
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.WAITING);

        mExecutor.advance(Duration.ofSeconds(1));
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.IDLE);
    }

    @Test
    public void tokenAck_whileWaiting_completes() throws Exception {
        mExchange.initiate("a");

        mExchange.handleTokenAck("a");

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.COMPLETED);
        assertThat(mExchange.hasPendingTimeout("a")).isFalse();
        assertThat(mExchange.hasCompletedExchange()).isTrue();
        verify(mMockListener).onExchangeCompleted("a");
    }

    @Test
    public void tokenAck_whileIdle_isIgnored() {
        mExchange.handleTokenAck("a");

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.IDLE);
        verify(mMockListener, never()).onExchangeCompleted(anyString());
    }

    @Test
    public void discoveryToken_configuresSessionAndAcknowledges() throws Exception {
        mExchange.handleDiscoveryToken("a", tokenMessage(PEER_TOKEN));
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.RECEIVED);
        assertThat(mExchange.getPeerToken("a").get()).isEqualTo(PEER_TOKEN);

        mExecutor.runPending();

        verify(mMockRangingProvider).configurePeer("a", PEER_TOKEN);
        verify(mMockSender).send("a", PeerMessageType.TOKEN_ACK,
                ImmutableMap.of(PeerMessage.Keys.ACK, "true"));
        assertThat(isPreciseRangingActive("a")).isTrue();
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.COMPLETED);
        verify(mMockListener).onExchangeCompleted("a");
    }

    @Test
    public void discoveryToken_afterCompleted_staysCompleted() throws Exception {
        mExchange.initiate("a");
        mExchange.handleTokenAck("a");

        mExchange.handleDiscoveryToken("a", tokenMessage(PEER_TOKEN));
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.COMPLETED);
        mExecutor.runPending();

        assertThat(isPreciseRangingActive("a")).isTrue();
        verify(mMockListener).onExchangeCompleted("a");
    }

    @Test
    public void discoveryToken_ackSendFails_stillCompletes() throws Exception {
        doThrow(new TransportException("link down")).when(mMockSender)
                .send(eq("a"), eq(PeerMessageType.TOKEN_ACK), anyMap());

        mExchange.handleDiscoveryToken("a", tokenMessage(PEER_TOKEN));
        mExecutor.runPending();

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.COMPLETED);
    }

    @Test
    public void discoveryToken_configureFails_revertsToIdle() throws Exception {
        when(mMockRangingProvider.configurePeer(anyString(), any()))
                .thenReturn(Futures.immediateFailedFuture(new RangingException("bad token")));

        mExchange.handleDiscoveryToken("a", tokenMessage(PEER_TOKEN));
        mExecutor.runPending();

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.IDLE);
        assertThat(mExchange.getPeerToken("a")).isEmpty();
        assertThat(isPreciseRangingActive("a")).isFalse();
        assertThat(mExchange.initiate("a")).isTrue();
    }

    @Test
    public void discoveryToken_configureFailsWhileWaiting_ackStillCompletes() throws Exception {
        when(mMockRangingProvider.configurePeer(anyString(), any()))
                .thenReturn(Futures.immediateFailedFuture(new RangingException("bad token")));
        mExchange.initiate("a");

        mExchange.handleDiscoveryToken("a", tokenMessage(PEER_TOKEN));
        mExecutor.runPending();

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.WAITING);
        assertThat(mExchange.hasPendingTimeout("a")).isTrue();

        mExchange.handleTokenAck("a");
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.COMPLETED);
    }

    @Test
    public void discoveryToken_configureFailsWhileWaiting_stillTimesOut() throws Exception {
        when(mMockRangingProvider.configurePeer(anyString(), any()))
                .thenReturn(Futures.immediateFailedFuture(new RangingException("bad token")));
        mExchange.initiate("a");
        mExchange.handleDiscoveryToken("a", tokenMessage(PEER_TOKEN));
        mExecutor.runPending();

        mExecutor.advance(Duration.ofSeconds(10));

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.IDLE);
    }

    @Test
    public void discoveryToken_malformed_isDropped() {
        mExchange.handleDiscoveryToken("a", tokenMessage("%%%"));
        mExchange.handleDiscoveryToken("a", tokenMessage(new byte[0]));
        mExchange.handleDiscoveryToken("a", PeerMessage.create(
                PeerMessageType.DISCOVERY_TOKEN, Instant.EPOCH));

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.IDLE);
        assertThat(mExchange.getPeerToken("a")).isEmpty();
        verify(mMockRangingProvider, never()).configurePeer(anyString(), any());
    }

    @Test
    public void discoveryToken_beforePreciseActive_isHeldUntilLocalToken() throws Exception {
        setPreciseActive(false);
        mExchange.handleDiscoveryToken("a", tokenMessage(PEER_TOKEN));
        mExecutor.runPending();
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.RECEIVED);
        verify(mMockRangingProvider, never()).configurePeer(anyString(), any());

        setPreciseActive(true);
        mExchange.onLocalTokenAvailable();
        mExecutor.runPending();

        verify(mMockRangingProvider).configurePeer("a", PEER_TOKEN);
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.COMPLETED);
        verify(mMockSender, never()).send(eq("a"), eq(PeerMessageType.DISCOVERY_TOKEN), anyMap());
    }

    @Test
    public void onLocalTokenAvailable_initiatesWithConnectedPeers() throws Exception {
        mRegistry.rehydrate("offline", "Offline");

        mExchange.onLocalTokenAvailable();

        verify(mMockSender).send(eq("a"), eq(PeerMessageType.DISCOVERY_TOKEN), anyMap());
        verify(mMockSender, never())
                .send(eq("offline"), eq(PeerMessageType.DISCOVERY_TOKEN), anyMap());
        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.WAITING);
    }

    @Test
    public void onPeerDisconnected_forgetsExchange() throws Exception {
        mExchange.initiate("a");
        mExchange.handleDiscoveryToken("a", tokenMessage(PEER_TOKEN));

        mExchange.onPeerDisconnected("a");

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.IDLE);
        assertThat(mExchange.getPeerToken("a")).isEmpty();
        assertThat(mExchange.hasPendingTimeout("a")).isFalse();
        verify(mMockRangingProvider).removePeer("a");
    }

    @Test
    public void onPreciseRangingLost_resetsCompletedExchanges() throws Exception {
        mExchange.handleDiscoveryToken("a", tokenMessage(PEER_TOKEN));
        mExecutor.runPending();

        mExchange.onPreciseRangingLost();

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.IDLE);
        assertThat(mExchange.hasCompletedExchange()).isFalse();
        assertThat(isPreciseRangingActive("a")).isFalse();
        verify(mMockListener).onExchangeReset("a");
    }

    @Test
    public void shutdown_cancelsTimers() throws Exception {
        mExchange.initiate("a");

        mExchange.shutdown();

        assertThat(mExchange.getState("a")).isEqualTo(TokenExchangeState.IDLE);
        assertThat(mExecutor.pendingCount()).isEqualTo(0);
    }
}
