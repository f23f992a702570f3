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
package com.arpnetworking.tsdcore.model;

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Raw metric series keyed by raw metric name. Each series iterates in
 * ascending timestamp order and holds exactly one value per timestamp. Names
 * iterate in natural order.
 */
public final class RawSeries {

    /**
     * Create a {@link RawSeries} without any samples.
     *
     * @return An empty {@link RawSeries}.
     */
    public static RawSeries empty() {
        return EMPTY;
    }

    public ImmutableSortedSet<String> getMetricNames() {
        return _seriesByName.keySet();
    }

    /**
     * The series of a raw metric.
     *
     * @param metricName The raw metric name.
     * @return The series in ascending timestamp order; empty if the metric has no samples.
     */
    public ImmutableSortedMap<Instant, Double> getSeries(final String metricName) {
        final ImmutableSortedMap<Instant, Double> series = _seriesByName.get(metricName);
        return series == null ? ImmutableSortedMap.of() : series;
    }

    /**
     * The value of a raw metric at exactly the given timestamp.
     *
     * @param metricName The raw metric name.
     * @param timestamp The timestamp.
     * @return The value if the metric reported one at that timestamp.
     */
    public Optional<Double> getValue(final String metricName, final Instant timestamp) {
        return Optional.ofNullable(getSeries(metricName).get(timestamp));
    }

    public boolean isEmpty() {
        return _seriesByName.isEmpty();
    }

    /**
     * The total number of samples across all series.
     *
     * @return The number of samples.
     */
    public int getSampleCount() {
        int count = 0;
        for (final ImmutableSortedMap<Instant, Double> series : _seriesByName.values()) {
            count += series.size();
        }
        return count;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("metricNames", _seriesByName.keySet())
                .put("sampleCount", getSampleCount())
                .build();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final RawSeries other = (RawSeries) object;

        return Objects.equal(_seriesByName, other._seriesByName);
    }

    @Override
    public int hashCode() {
        return _seriesByName.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("SeriesByName", _seriesByName)
                .toString();
    }

    private RawSeries(final ImmutableSortedMap<String, ImmutableSortedMap<Instant, Double>> seriesByName) {
        _seriesByName = seriesByName;
    }

    private final ImmutableSortedMap<String, ImmutableSortedMap<Instant, Double>> _seriesByName;

    private static final RawSeries EMPTY = new RawSeries(ImmutableSortedMap.of());

    /**
     * Accumulates samples into a {@link RawSeries}. When two samples of the
     * same metric share a timestamp the one added last is kept.
     */
    public static final class Builder {

        /**
         * Add a sample.
         *
         * @param sample The sample.
         * @return This {@link Builder} instance.
         */
        public Builder addSample(final RawSample sample) {
            _seriesByName.computeIfAbsent(sample.getMetricName(), name -> new TreeMap<>())
                    .put(sample.getTimestamp(), sample.getAverage());
            return this;
        }

        /**
         * Add samples in iteration order.
         *
         * @param samples The samples.
         * @return This {@link Builder} instance.
         */
        public Builder addSamples(final Iterable<RawSample> samples) {
            for (final RawSample sample : samples) {
                addSample(sample);
            }
            return this;
        }

        /**
         * Create the {@link RawSeries}.
         *
         * @return The {@link RawSeries} containing every sample added so far.
         */
        public RawSeries build() {
            final ImmutableSortedMap.Builder<String, ImmutableSortedMap<Instant, Double>> seriesByName =
                    ImmutableSortedMap.naturalOrder();
            for (final Map.Entry<String, TreeMap<Instant, Double>> entry : _seriesByName.entrySet()) {
                seriesByName.put(entry.getKey(), ImmutableSortedMap.copyOfSorted(entry.getValue()));
            }
            return new RawSeries(seriesByName.build());
        }

        private final Map<String, TreeMap<Instant, Double>> _seriesByName = Maps.newHashMap();
    }
}
