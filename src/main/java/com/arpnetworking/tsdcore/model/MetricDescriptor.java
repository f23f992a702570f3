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
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * Identifies one raw metric stream in the monitoring API: the namespace it is
 * published under, its name and the dimensions qualifying it. Statistics are
 * requested with exactly these values.
 */
@Loggable
public final class MetricDescriptor {

    public String getNamespace() {
        return _namespace;
    }

    public String getMetricName() {
        return _metricName;
    }

    public ImmutableMap<String, String> getDimensions() {
        return _dimensions;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final MetricDescriptor other = (MetricDescriptor) object;

        return Objects.equal(_namespace, other._namespace)
                && Objects.equal(_metricName, other._metricName)
                && Objects.equal(_dimensions, other._dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_namespace, _metricName, _dimensions);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Namespace", _namespace)
                .add("MetricName", _metricName)
                .add("Dimensions", _dimensions)
                .toString();
    }

    private MetricDescriptor(final Builder builder) {
        _namespace = builder._namespace;
        _metricName = builder._metricName;
        _dimensions = builder._dimensions;
    }

    private final String _namespace;
    private final String _metricName;
    private final ImmutableMap<String, String> _dimensions;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MetricDescriptor}.
     */
    public static final class Builder extends OvalBuilder<MetricDescriptor> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MetricDescriptor::new);
        }

        /**
         * Set the namespace. Required. Cannot be null or empty.
         *
         * @param value The namespace.
         * @return This {@link Builder} instance.
         */
        public Builder setNamespace(final String value) {
            _namespace = value;
            return this;
        }

        /**
         * Set the metric name. Required. Cannot be null or empty.
         *
         * @param value The metric name.
         * @return This {@link Builder} instance.
         */
        public Builder setMetricName(final String value) {
            _metricName = value;
            return this;
        }

        /**
         * Set the dimensions. Optional. Cannot be null. Defaults to an empty {@link ImmutableMap}.
         *
         * @param value The dimensions.
         * @return This {@link Builder} instance.
         */
        public Builder setDimensions(final ImmutableMap<String, String> value) {
            _dimensions = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _namespace;
        @NotNull
        @NotEmpty
        private String _metricName;
        @NotNull
        private ImmutableMap<String, String> _dimensions = ImmutableMap.of();
    }
}
