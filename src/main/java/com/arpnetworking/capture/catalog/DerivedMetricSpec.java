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
package com.arpnetworking.capture.catalog;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.arpnetworking.tsdcore.statistics.AggregationRule;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * Definition of a derived metric: the raw metrics it is computed from, the
 * rule combining them and how the result is described downstream.
 */
@Loggable
public final class DerivedMetricSpec {

    public String getKey() {
        return _key;
    }

    /**
     * The raw metric names the derived metric is computed from. Any subset of
     * them may be reported for a given target.
     *
     * @return The source raw metric names in declaration order.
     */
    public ImmutableList<String> getSourceMetrics() {
        return _sourceMetrics;
    }

    public AggregationRule getRule() {
        return _rule;
    }

    public CounterMetadata getMetadata() {
        return _metadata;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final DerivedMetricSpec other = (DerivedMetricSpec) object;

        return Objects.equal(_key, other._key)
                && Objects.equal(_sourceMetrics, other._sourceMetrics)
                && _rule == other._rule
                && Objects.equal(_metadata, other._metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_key, _sourceMetrics, _rule, _metadata);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Key", _key)
                .add("SourceMetrics", _sourceMetrics)
                .add("Rule", _rule)
                .add("Metadata", _metadata)
                .toString();
    }

    private DerivedMetricSpec(final Builder builder) {
        _key = builder._key;
        _sourceMetrics = builder._sourceMetrics;
        _rule = builder._rule;
        _metadata = new CounterMetadata.Builder()
                .setCounterKey(builder._key)
                .setPrecision(builder._precision)
                .setUnitKey(builder._unitKey)
                .build();
    }

    private final String _key;
    private final ImmutableList<String> _sourceMetrics;
    private final AggregationRule _rule;
    private final CounterMetadata _metadata;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link DerivedMetricSpec}.
     */
    public static final class Builder extends OvalBuilder<DerivedMetricSpec> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(DerivedMetricSpec::new);
        }

        /**
         * Set the derived metric key. Required. Cannot be null or empty.
         *
         * @param value The key.
         * @return This {@link Builder} instance.
         */
        public Builder setKey(final String value) {
            _key = value;
            return this;
        }

        /**
         * Set the source raw metric names. Required. Cannot be null or empty.
         *
         * @param value The source raw metric names.
         * @return This {@link Builder} instance.
         */
        public Builder setSourceMetrics(final ImmutableList<String> value) {
            _sourceMetrics = value;
            return this;
        }

        /**
         * Set the aggregation rule. Required. Cannot be null.
         *
         * @param value The aggregation rule.
         * @return This {@link Builder} instance.
         */
        public Builder setRule(final AggregationRule value) {
            _rule = value;
            return this;
        }

        /**
         * Set the unit key reported downstream. Required. Cannot be null or empty.
         *
         * @param value The unit key.
         * @return This {@link Builder} instance.
         */
        public Builder setUnitKey(final String value) {
            _unitKey = value;
            return this;
        }

        /**
         * Set the precision reported downstream. Required. Cannot be null or negative.
         *
         * @param value The precision.
         * @return This {@link Builder} instance.
         */
        public Builder setPrecision(final Integer value) {
            _precision = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _key;
        @NotNull
        @NotEmpty
        private ImmutableList<String> _sourceMetrics;
        @NotNull
        private AggregationRule _rule;
        @NotNull
        @NotEmpty
        private String _unitKey;
        @NotNull
        @Min(0)
        private Integer _precision;
    }
}
