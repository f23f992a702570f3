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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.time.Instant;

/**
 * A single average value of a raw metric as reported by the monitoring API.
 */
@Loggable
public final class RawSample {

    public String getMetricName() {
        return _metricName;
    }

    public Instant getTimestamp() {
        return _timestamp;
    }

    public double getAverage() {
        return _average;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final RawSample other = (RawSample) object;

        return Double.compare(_average, other._average) == 0
                && Objects.equal(_metricName, other._metricName)
                && Objects.equal(_timestamp, other._timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_metricName, _timestamp, _average);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("MetricName", _metricName)
                .add("Timestamp", _timestamp)
                .add("Average", _average)
                .toString();
    }

    private RawSample(final Builder builder) {
        _metricName = builder._metricName;
        _timestamp = builder._timestamp;
        _average = builder._average;
    }

    private final String _metricName;
    private final Instant _timestamp;
    private final double _average;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link RawSample}.
     */
    public static final class Builder extends OvalBuilder<RawSample> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(RawSample::new);
        }

        /**
         * Set the raw metric name. Required. Cannot be null or empty.
         *
         * @param value The metric name.
         * @return This {@link Builder} instance.
         */
        public Builder setMetricName(final String value) {
            _metricName = value;
            return this;
        }

        /**
         * Set the timestamp. Required. Cannot be null.
         *
         * @param value The timestamp.
         * @return This {@link Builder} instance.
         */
        public Builder setTimestamp(final Instant value) {
            _timestamp = value;
            return this;
        }

        /**
         * Set the average. Required. Cannot be null.
         *
         * @param value The average.
         * @return This {@link Builder} instance.
         */
        public Builder setAverage(final Double value) {
            _average = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _metricName;
        @NotNull
        private Instant _timestamp;
        @NotNull
        private Double _average;
    }
}
