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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.gson.annotations.SerializedName;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/** Persisted record of a completed pairing. */
public final class PairedDevice {
    @SerializedName("id")
    private final String mId;

    @SerializedName("name")
    private final String mName;

    /** Milliseconds since epoch. */
    @SerializedName("pairedAt")
    private final long mPairedAt;

    /** Milliseconds since epoch, absent until the first reconnection. */
    @SerializedName("lastConnected")
    private final @Nullable Long mLastConnected;

    public PairedDevice(@NonNull String id, @NonNull String name, @NonNull Instant pairedAt,
            @Nullable Instant lastConnected) {
        Preconditions.checkArgument(!id.isEmpty(), "Paired device id must not be empty");
        mId = id;
        mName = name;
        mPairedAt = pairedAt.toEpochMilli();
        mLastConnected = lastConnected == null ? null : lastConnected.toEpochMilli();
    }

    public @NonNull String getId() {
        return mId;
    }

    public @NonNull String getName() {
        return mName;
    }

    public @NonNull Instant getPairedAt() {
        return Instant.ofEpochMilli(mPairedAt);
    }

    public Optional<Instant> getLastConnected() {
        return Optional.ofNullable(mLastConnected).map(Instant::ofEpochMilli);
    }

    /** @return a copy of this record with the last connection time replaced. */
    public @NonNull PairedDevice withLastConnected(@NonNull Instant lastConnected) {
        return new PairedDevice(mId, mName, getPairedAt(), lastConnected);
    }

    /** Records read from storage may lack fields Gson could not fill. */
    boolean isWellFormed() {
        return mId != null && !mId.isEmpty() && mName != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PairedDevice)) {
            return false;
        }
        PairedDevice that = (PairedDevice) o;
        return mPairedAt == that.mPairedAt
                && mId.equals(that.mId)
                && mName.equals(that.mName)
                && Objects.equals(mLastConnected, that.mLastConnected);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mId, mName, mPairedAt, mLastConnected);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", mId)
                .add("name", mName)
                .add("pairedAt", getPairedAt())
                .add("lastConnected", getLastConnected().orElse(null))
                .toString();
    }
}
