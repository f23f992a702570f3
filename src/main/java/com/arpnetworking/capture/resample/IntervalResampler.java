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
package com.arpnetworking.capture.resample;

import com.arpnetworking.capture.catalog.CounterCatalog;
import com.arpnetworking.capture.catalog.DerivedMetricSpec;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tsdcore.model.PointTable;
import com.arpnetworking.tsdcore.model.RawSeries;
import com.arpnetworking.tsdcore.model.ResampledPoint;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;

/**
 * Converts raw series of unknown cadence into derived metric points on a fixed
 * 20 second grid.
 *
 * <p>The monitoring API does not say whether a series is reported every
 * minute or every five minutes, so the cadence is inferred from the spacing of
 * consecutive timestamps. Only a gap of exactly one of the known cadences is
 * trusted; any other gap, and the first timestamp which has no predecessor,
 * produces no points. The value computed at the end of a trusted gap is held
 * over every grid tick after the start of the gap up to and including its
 * end.</p>
 *
 * <p>Instances are stateless and may be shared.</p>
 */
public final class IntervalResampler {

    /**
     * Resample every derived metric of the catalog.
     *
     * @param catalog The derived metric definitions.
     * @param series The raw series.
     * @return The derived points.
     */
    public PointTable resample(final CounterCatalog catalog, final RawSeries series) {
        final PointTable.Builder points = new PointTable.Builder();
        for (final DerivedMetricSpec spec : catalog.getSpecs()) {
            resampleMetric(catalog, spec, series, points);
        }
        return points.build();
    }

    private void resampleMetric(
            final CounterCatalog catalog,
            final DerivedMetricSpec spec,
            final RawSeries series,
            final PointTable.Builder points) {
        final NavigableSet<Instant> timestamps = Sets.newTreeSet();
        for (final String source : spec.getSourceMetrics()) {
            timestamps.addAll(series.getSeries(source).keySet());
        }

        int accepted = 0;
        int discarded = 0;
        int emitted = 0;
        Instant previous = null;
        for (final Instant current : timestamps) {
            if (previous != null) {
                final Duration gap = Duration.between(previous, current);
                if (CADENCES.contains(gap)) {
                    final Optional<Double> value = catalog.computeFor(spec.getKey(), valuesAt(spec, series, current), gap);
                    if (value.isPresent()) {
                        emitted += expand(spec.getKey(), previous, current, value.get(), points);
                    }
                    ++accepted;
                } else {
                    ++discarded;
                }
            }
            previous = current;
        }

        LOGGER.debug()
                .setMessage("Resampled derived metric")
                .addData("derivedKey", spec.getKey())
                .addData("timestamps", timestamps.size())
                .addData("acceptedIntervals", accepted)
                .addData("discardedIntervals", discarded)
                .addData("points", emitted)
                .log();
    }

    private static Map<String, Double> valuesAt(final DerivedMetricSpec spec, final RawSeries series, final Instant timestamp) {
        final Map<String, Double> values = Maps.newHashMap();
        for (final String source : spec.getSourceMetrics()) {
            series.getValue(source, timestamp).ifPresent(value -> values.put(source, value));
        }
        return values;
    }

    private static int expand(
            final String derivedKey,
            final Instant previous,
            final Instant current,
            final double value,
            final PointTable.Builder points) {
        int count = 0;
        for (Instant tick = previous.plus(FINE_STEP); !tick.isAfter(current); tick = tick.plus(FINE_STEP)) {
            points.addPoint(new ResampledPoint.Builder()
                    .setTimestamp(tick)
                    .setDerivedKey(derivedKey)
                    .setValue(value)
                    .build());
            ++count;
        }
        return count;
    }

    static final Duration FINE_STEP = Duration.ofSeconds(20);
    static final ImmutableSet<Duration> CADENCES = ImmutableSet.of(Duration.ofMinutes(1), Duration.ofMinutes(5));

    private static final Logger LOGGER = LoggerFactory.getLogger(IntervalResampler.class);
}
