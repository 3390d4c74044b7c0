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

package com.proximity.ranging;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/** A single raw observation produced by a ranging source. */
public class RangingData {
    private final RangingTechnology mTechnology;
    private final @Nullable String mPeerId;
    private final double mRangeDistance;
    private final int mRssi;
    private final double mAzimuth;
    private final double mElevation;
    private final Instant mTimestamp;

    /** @return the ranging technology that produced this data. */
    public @NonNull RangingTechnology getTechnology() {
        return mTechnology;
    }

    /**
     * @return the peer this data refers to, or {@code Optional.empty()} if the source could not
     * attribute it to a peer.
     */
    public Optional<String> getPeerId() {
        return Optional.ofNullable(mPeerId);
    }

    /** @return range distance in meters, if provided. */
    public OptionalDouble getRangeMeters() {
        if (Double.isNaN(mRangeDistance)) {
            return OptionalDouble.empty();
        } else {
            return OptionalDouble.of(mRangeDistance);
        }
    }

    /** @return rssi in dBm, if provided. */
    public OptionalInt getRssi() {
        if (mRssi == Integer.MIN_VALUE) {
            return OptionalInt.empty();
        } else {
            return OptionalInt.of(mRssi);
        }
    }

    /** @return azimuth angle in radians, if provided. */
    public OptionalDouble getAzimuthRadians() {
        if (Double.isNaN(mAzimuth)) {
            return OptionalDouble.empty();
        } else {
            return OptionalDouble.of(mAzimuth);
        }
    }

    /** @return elevation angle in radians, if provided. */
    public OptionalDouble getElevationRadians() {
        if (Double.isNaN(mElevation)) {
            return OptionalDouble.empty();
        } else {
            return OptionalDouble.of(mElevation);
        }
    }

    /**
     * @return the measurement the peer registry consumes: meters for {@link
     * RangingTechnology#PRECISE}, dBm for {@link RangingTechnology#SIGNAL_STRENGTH}.
     */
    public double getRawValue() {
        return mTechnology == RangingTechnology.PRECISE ? mRangeDistance : mRssi;
    }

    /** @return the time at which this data was received. */
    public @NonNull Instant getTimestamp() {
        return mTimestamp;
    }

    @Override
    public String toString() {
        return "RangingData{" + mTechnology + ", peer=" + mPeerId + ", value=" + getRawValue()
                + ", at=" + mTimestamp + "}";
    }

    private RangingData(Builder builder) {
        Preconditions.checkArgument(builder.mTechnology != null,
                "Technology is required but was not provided");
        Preconditions.checkArgument(builder.mTimestamp != null,
                "Timestamp is required but was not provided");
        if (builder.mTechnology == RangingTechnology.PRECISE) {
            Preconditions.checkArgument(!Double.isNaN(builder.mRangeDistance),
                    "Range distance is required for precise data but was not provided");
        } else {
            Preconditions.checkArgument(builder.mRssi != Integer.MIN_VALUE,
                    "Rssi is required for signal strength data but was not provided");
        }

        mTechnology = builder.mTechnology;
        mPeerId = builder.mPeerId;
        mRangeDistance = builder.mRangeDistance;
        mRssi = builder.mRssi;
        mAzimuth = builder.mAzimuth;
        mElevation = builder.mElevation;
        mTimestamp = builder.mTimestamp;
    }

    /**
     * Builder for {@link RangingData}.
     */
    public static class Builder {
        private RangingTechnology mTechnology = null;
        private String mPeerId = null;
        private double mRangeDistance = Double.NaN;
        private int mRssi = Integer.MIN_VALUE;
        private double mAzimuth = Double.NaN;
        private double mElevation = Double.NaN;
        private Instant mTimestamp = null;

        public Builder() {
        }

        /** @return the built {@link RangingData}. */
        public RangingData build() {
            return new RangingData(this);
        }

        /** @param technology that produced this data. */
        public Builder setTechnology(@NonNull RangingTechnology technology) {
            mTechnology = technology;
            return this;
        }

        /** @param peerId the data refers to, or null if unknown. */
        public Builder setPeerId(@Nullable String peerId) {
            mPeerId = peerId;
            return this;
        }

        /** @param distance - measured distance in meters. */
        public Builder setRangeDistance(double distance) {
            mRangeDistance = distance;
            return this;
        }

        /** @param rssi in dBm. */
        public Builder setRssi(int rssi) {
            mRssi = rssi;
            return this;
        }

        /** @param azimuth angle in radians */
        public Builder setAzimuthRadians(double azimuth) {
            mAzimuth = azimuth;
            return this;
        }

        /** @param elevation angle in radians. */
        public Builder setElevationRadians(double elevation) {
            mElevation = elevation;
            return this;
        }

        /** @param timestamp at which the data was received. */
        public Builder setTimestamp(@NonNull Instant timestamp) {
            mTimestamp = timestamp;
            return this;
        }
    }
}
