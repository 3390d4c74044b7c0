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

package com.proximity.pairing;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.List;

/**
 * Persistence boundary for the paired device list. The list is always read and written whole;
 * a reader never observes a partially written list.
 */
public interface PairingStore {

    /** @return the stored list, empty if nothing was stored yet. */
    @NonNull ImmutableList<PairedDevice> loadPairedDevices();

    /** Replace the stored list. */
    void savePairedDevices(@NonNull List<PairedDevice> devices);
}
