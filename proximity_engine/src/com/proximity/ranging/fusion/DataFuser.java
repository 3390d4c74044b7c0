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

package com.proximity.ranging.fusion;

import com.proximity.ranging.RangingData;
import com.proximity.ranging.RangingTechnology;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.Optional;
import java.util.Set;

/**
 * Incrementally combines data from multiple ranging technologies for one peer.
 */
public interface DataFuser {
    /**
     * Provide data to the fuser.
     *
     * @param data    produced from a ranging technology.
     * @param sources of ranging data currently active for the peer the data refers to.
     *                <b>Implementations of this method must not mutate this parameter.</b>
     * @return fused data if the provided data makes any available.
     */
    Optional<RangingData> fuse(
            @NonNull RangingData data, final @NonNull Set<RangingTechnology> sources
    );
}
