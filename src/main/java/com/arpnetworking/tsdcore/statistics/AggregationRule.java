/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.tsdcore.statistics;

import com.google.common.base.Preconditions;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * How the values of the source metrics of a derived metric are combined into
 * one value for an interval.
 */
public enum AggregationRule {

    /**
     * Sum of the values divided by 1024 and by the interval length in seconds.
     * Turns byte counts reported per interval into a kilobytes per second rate.
     */
    SCALED_SUM_RATE,

    /**
     * Arithmetic mean of the values. Used for percentages.
     */
    MEAN;

    /**
     * Combine the values present for an interval. Sources that did not report
     * are not part of the list; they contribute nothing to a sum and are not
     * counted in a mean.
     *
     * @param presentValues The values reported at the end of the interval.
     * @param interval The length of the interval. Must be positive.
     * @return The combined value; empty if no value is present.
     */
    public Optional<Double> aggregate(final List<Double> presentValues, final Duration interval) {
        Preconditions.checkArgument(
                !interval.isNegative() && !interval.isZero(),
                "Interval must be positive; interval=%s",
                interval);
        if (presentValues.isEmpty()) {
            return Optional.empty();
        }
        double sum = 0.0;
        for (final Double value : presentValues) {
            sum += value;
        }
        switch (this) {
            case SCALED_SUM_RATE:
                return Optional.of(sum / KILO / (interval.toMillis() / 1000.0));
            case MEAN:
                return Optional.of(sum / presentValues.size());
            default:
                throw new IllegalStateException("Unsupported aggregation rule: " + this);
        }
    }

    private static final double KILO = 1024.0;
}
