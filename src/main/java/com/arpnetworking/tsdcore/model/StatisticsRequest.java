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
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.Duration;

/**
 * Request for one statistic of one raw metric over one window, aggregated by
 * the monitoring API into buckets of the given period.
 */
@Loggable
public final class StatisticsRequest {

    public MetricDescriptor getMetric() {
        return _metric;
    }

    public TimeWindow getWindow() {
        return _window;
    }

    public Duration getPeriod() {
        return _period;
    }

    public String getStatistic() {
        return _statistic;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final StatisticsRequest other = (StatisticsRequest) object;

        return Objects.equal(_metric, other._metric)
                && Objects.equal(_window, other._window)
                && Objects.equal(_period, other._period)
                && Objects.equal(_statistic, other._statistic);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_metric, _window, _period, _statistic);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Metric", _metric)
                .add("Window", _window)
                .add("Period", _period)
                .add("Statistic", _statistic)
                .toString();
    }

    private StatisticsRequest(final Builder builder) {
        _metric = builder._metric;
        _window = builder._window;
        _period = builder._period;
        _statistic = builder._statistic;
    }

    private final MetricDescriptor _metric;
    private final TimeWindow _window;
    private final Duration _period;
    private final String _statistic;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link StatisticsRequest}.
     */
    public static final class Builder extends OvalBuilder<StatisticsRequest> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(StatisticsRequest::new);
        }

        /**
         * Set the metric. Required. Cannot be null.
         *
         * @param value The metric.
         * @return This {@link Builder} instance.
         */
        public Builder setMetric(final MetricDescriptor value) {
            _metric = value;
            return this;
        }

        /**
         * Set the window. Required. Cannot be null.
         *
         * @param value The window.
         * @return This {@link Builder} instance.
         */
        public Builder setWindow(final TimeWindow value) {
            _window = value;
            return this;
        }

        /**
         * Set the period. Optional. Cannot be null. Must be a positive whole
         * number of seconds. Defaults to one minute.
         *
         * @param value The period.
         * @return This {@link Builder} instance.
         */
        public Builder setPeriod(final Duration value) {
            _period = value;
            return this;
        }

        /**
         * Set the statistic. Optional. Cannot be null or empty. Defaults to
         * {@code Average}.
         *
         * @param value The statistic.
         * @return This {@link Builder} instance.
         */
        public Builder setStatistic(final String value) {
            _statistic = value;
            return this;
        }

        /**
         * Validate the period.
         *
         * @param period the requested period
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validatePeriod(final Duration period) {
            return !period.isNegative() && !period.isZero() && period.getNano() == 0;
        }

        @NotNull
        private MetricDescriptor _metric;
        @NotNull
        private TimeWindow _window;
        @NotNull
        @ValidateWithMethod(methodName = "validatePeriod", parameterType = Duration.class)
        private Duration _period = Duration.ofMinutes(1);
        @NotNull
        @NotEmpty
        private String _statistic = "Average";
    }
}
