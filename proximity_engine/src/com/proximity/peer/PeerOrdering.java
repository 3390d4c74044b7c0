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

package com.proximity.peer;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.Collection;
import java.util.Comparator;

/** Orderings for presenting peers. */
public final class PeerOrdering {
    private PeerOrdering() {
    }

    /** Compatible peers first, then nearest first. Unranged peers sort after ranged ones. */
    public static final Comparator<Peer> BY_DISTANCE =
            Comparator.comparing((Peer peer) -> !peer.isCompatiblePeer())
                    .thenComparing((Peer peer) -> peer.getDistance() <= 0)
                    .thenComparingDouble(Peer::getDistance);

    /** Strongest signal first. Peers without a signal strength sort last. */
    public static final Comparator<Peer> BY_SIGNAL_STRENGTH =
            Comparator.comparingInt(
                    (Peer peer) -> -peer.getRawSignalStrength().orElse(Integer.MIN_VALUE + 1));

    /** Most recently seen first. */
    public static final Comparator<Peer> BY_LAST_SEEN =
            Comparator.comparing(Peer::getLastSeen).reversed();

    /** @return {@code peers} sorted with {@code ordering}. */
    public static ImmutableList<Peer> sorted(
            @NonNull Collection<Peer> peers, @NonNull Comparator<Peer> ordering) {
        return ImmutableList.sortedCopyOf(ordering, peers);
    }
}
