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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Derived metric values indexed by timestamp and then by derived metric key.
 * Timestamps iterate in ascending order and keys in natural order. Each
 * (timestamp, key) pair holds exactly one value.
 */
public final class PointTable {

    /**
     * Create a {@link PointTable} without any points.
     *
     * @return An empty {@link PointTable}.
     */
    public static PointTable empty() {
        return EMPTY;
    }

    public ImmutableSortedMap<Instant, ImmutableSortedMap<String, Double>> getValuesByTimestamp() {
        return _valuesByTimestamp;
    }

    /**
     * The value of a derived metric at a timestamp.
     *
     * @param timestamp The timestamp.
     * @param derivedKey The derived metric key.
     * @return The value if one was produced.
     */
    public Optional<Double> getValue(final Instant timestamp, final String derivedKey) {
        final ImmutableSortedMap<String, Double> values = _valuesByTimestamp.get(timestamp);
        if (values == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(derivedKey));
    }

    /**
     * The values of one derived metric.
     *
     * @param derivedKey The derived metric key.
     * @return The values by ascending timestamp.
     */
    public ImmutableSortedMap<Instant, Double> getSeries(final String derivedKey) {
        final ImmutableSortedMap.Builder<Instant, Double> series = ImmutableSortedMap.naturalOrder();
        for (final Map.Entry<Instant, ImmutableSortedMap<String, Double>> entry : _valuesByTimestamp.entrySet()) {
            final Double value = entry.getValue().get(derivedKey);
            if (value != null) {
                series.put(entry.getKey(), value);
            }
        }
        return series.build();
    }

    /**
     * Every point in ascending timestamp order and then key order.
     *
     * @return The points.
     */
    public ImmutableList<ResampledPoint> getPoints() {
        final ImmutableList.Builder<ResampledPoint> points = ImmutableList.builder();
        for (final Map.Entry<Instant, ImmutableSortedMap<String, Double>> entry : _valuesByTimestamp.entrySet()) {
            for (final Map.Entry<String, Double> value : entry.getValue().entrySet()) {
                points.add(new ResampledPoint.Builder()
                        .setTimestamp(entry.getKey())
                        .setDerivedKey(value.getKey())
                        .setValue(value.getValue())
                        .build());
            }
        }
        return points.build();
    }

    /**
     * The number of points.
     *
     * @return The number of points.
     */
    public int size() {
        int size = 0;
        for (final ImmutableSortedMap<String, Double> values : _valuesByTimestamp.values()) {
            size += values.size();
        }
        return size;
    }

    public boolean isEmpty() {
        return _valuesByTimestamp.isEmpty();
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("timestamps", _valuesByTimestamp.size())
                .put("points", size())
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

        final PointTable other = (PointTable) object;

        return Objects.equal(_valuesByTimestamp, other._valuesByTimestamp);
    }

    @Override
    public int hashCode() {
        return _valuesByTimestamp.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("ValuesByTimestamp", _valuesByTimestamp)
                .toString();
    }

    private PointTable(final ImmutableSortedMap<Instant, ImmutableSortedMap<String, Double>> valuesByTimestamp) {
        _valuesByTimestamp = valuesByTimestamp;
    }

    private final ImmutableSortedMap<Instant, ImmutableSortedMap<String, Double>> _valuesByTimestamp;

    private static final PointTable EMPTY = new PointTable(ImmutableSortedMap.of());

    /**
     * Accumulates points into a {@link PointTable}.
     */
    public static final class Builder {

        /**
         * Add a point.
         *
         * @param point The point.
         * @return This {@link Builder} instance.
         * @throws IllegalStateException if a value already exists for the point's timestamp and key.
         */
        public Builder addPoint(final ResampledPoint point) {
            final Map<String, Double> values = _valuesByTimestamp.computeIfAbsent(point.getTimestamp(), ts -> new TreeMap<>());
            final Double existing = values.putIfAbsent(point.getDerivedKey(), point.getValue());
            if (existing != null) {
                throw new IllegalStateException(String.format(
                        "Point already present; timestamp=%s, derivedKey=%s, existing=%s, new=%s",
                        point.getTimestamp(),
                        point.getDerivedKey(),
                        existing,
                        point.getValue()));
            }
            return this;
        }

        /**
         * Create the {@link PointTable}.
         *
         * @return The {@link PointTable} containing every point added so far.
         */
        public PointTable build() {
            final ImmutableSortedMap.Builder<Instant, ImmutableSortedMap<String, Double>> valuesByTimestamp =
                    ImmutableSortedMap.naturalOrder();
            for (final Map.Entry<Instant, TreeMap<String, Double>> entry : _valuesByTimestamp.entrySet()) {
                valuesByTimestamp.put(entry.getKey(), ImmutableSortedMap.copyOfSorted(entry.getValue()));
            }
            return new PointTable(valuesByTimestamp.build());
        }

        private final Map<Instant, TreeMap<String, Double>> _valuesByTimestamp = Maps.newHashMap();
    }
}
