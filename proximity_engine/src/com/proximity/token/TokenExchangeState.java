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

package com.proximity.token;

/** Progress of the ranging token exchange with one peer. */
public enum TokenExchangeState {
    /** Nothing sent or received. */
    IDLE,
    /** Our token was sent; waiting for the acknowledgement. */
    WAITING,
    /** The peer's token arrived; the precise session is being configured. */
    RECEIVED,
    /** A usable token is held on at least one side; precise ranging can run. */
    COMPLETED,
}
