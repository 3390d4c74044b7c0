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

package com.proximity.distance;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Smoothers {
    /** Fewer samples than this are averaged without any outlier rejection. */
    public static final int MIN_SAMPLES_FOR_REJECTION = 3;

    private Smoothers() {
    }

    /** @return the smoother implementing {@code policy}. */
    public static @NonNull SampleSmoother forPolicy(@NonNull SmoothingPolicy policy) {
        switch (policy) {
            case SIGMA_REJECTION:
                return new SigmaRejectionSmoother();
            case TRIMMED_MEAN:
                return new TrimmedMeanSmoother();
            default:
                throw new IllegalArgumentException("Unknown smoothing policy " + policy);
        }
    }

    static double mean(List<Double> values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Rejects samples that lie more than two standard deviations away from the mean of the other
     * samples in the window, then averages the rest. If every sample is rejected the plain mean of
     * the window is returned.
     *
     * <p>Each sample is judged against the remaining samples rather than the whole window: a single
     * outlier inflates the whole-window deviation so much that, with five samples, it can never
     * lie more than 1.79 deviations from the mean.
     */
    public static class SigmaRejectionSmoother implements SampleSmoother {
        private static final double MAX_DEVIATIONS = 2.0;

        @Override
        public double smooth(final @NonNull List<Double> window) {
            if (window.size() < MIN_SAMPLES_FOR_REJECTION) {
                return mean(window);
            }

            List<Double> kept = new ArrayList<>(window.size());
            List<Double> others = new ArrayList<>(window.size() - 1);
            for (int i = 0; i < window.size(); i++) {
                others.clear();
                for (int j = 0; j < window.size(); j++) {
                    if (j != i) {
                        others.add(window.get(j));
                    }
                }
                double othersMean = mean(others);
                double variance = 0;
                for (double other : others) {
                    variance += (other - othersMean) * (other - othersMean);
                }
                double stdDev = Math.sqrt(variance / others.size());

                double sample = window.get(i);
                if (Math.abs(sample - othersMean) <= MAX_DEVIATIONS * stdDev) {
                    kept.add(sample);
                }
            }
            return kept.isEmpty() ? mean(window) : mean(kept);
        }
    }

    /** Drops the single lowest and highest sample and averages the remainder. */
    public static class TrimmedMeanSmoother implements SampleSmoother {
        @Override
        public double smooth(final @NonNull List<Double> window) {
            if (window.size() < MIN_SAMPLES_FOR_REJECTION) {
                return mean(window);
            }
            List<Double> sorted = new ArrayList<>(window);
            Collections.sort(sorted);
            return mean(sorted.subList(1, sorted.size() - 1));
        }
    }
}
