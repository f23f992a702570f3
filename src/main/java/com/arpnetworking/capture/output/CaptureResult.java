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
package com.arpnetworking.capture.output;

import com.arpnetworking.capture.catalog.CounterMetadata;
import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.NotNull;

import java.util.Map;

/**
 * The outcome of one capture: the metadata of every derived metric and the
 * derived values by ISO-8601 timestamp, both keyed by target identity.
 */
@JsonPropertyOrder({"counters_by_id", "counter_values_by_id"})
public final class CaptureResult {

    @JsonProperty("counters_by_id")
    public ImmutableMap<String, ImmutableMap<String, CounterMetadata>> getCountersById() {
        return _countersById;
    }

    @JsonProperty("counter_values_by_id")
    public ImmutableMap<String, ImmutableMap<String, ImmutableMap<String, Double>>> getCounterValuesById() {
        return _counterValuesById;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final CaptureResult other = (CaptureResult) object;

        return Objects.equal(_countersById, other._countersById)
                && Objects.equal(_counterValuesById, other._counterValuesById);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_countersById, _counterValuesById);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        final ImmutableMap.Builder<String, Integer> timestampsById = ImmutableMap.builder();
        for (final Map.Entry<String, ImmutableMap<String, ImmutableMap<String, Double>>> entry : _counterValuesById.entrySet()) {
            timestampsById.put(entry.getKey(), entry.getValue().size());
        }
        return LogValueMapFactory.builder(this)
                .put("targetIds", _countersById.keySet())
                .put("timestampsById", timestampsById.build())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private CaptureResult(final Builder builder) {
        _countersById = builder._countersById;
        _counterValuesById = builder._counterValuesById;
    }

    private final ImmutableMap<String, ImmutableMap<String, CounterMetadata>> _countersById;
    private final ImmutableMap<String, ImmutableMap<String, ImmutableMap<String, Double>>> _counterValuesById;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link CaptureResult}.
     */
    public static final class Builder extends OvalBuilder<CaptureResult> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(CaptureResult::new);
        }

        /**
         * Set the derived metric metadata by target identity. Required. Cannot be null.
         *
         * @param value The metadata by target identity.
         * @return This {@link Builder} instance.
         */
        public Builder setCountersById(final ImmutableMap<String, ImmutableMap<String, CounterMetadata>> value) {
            _countersById = value;
            return this;
        }

        /**
         * Set the derived values by target identity. Required. Cannot be null.
         *
         * @param value The values by timestamp by target identity.
         * @return This {@link Builder} instance.
         */
        public Builder setCounterValuesById(
                final ImmutableMap<String, ImmutableMap<String, ImmutableMap<String, Double>>> value) {
            _counterValuesById = value;
            return this;
        }

        @NotNull
        private ImmutableMap<String, ImmutableMap<String, CounterMetadata>> _countersById;
        @NotNull
        private ImmutableMap<String, ImmutableMap<String, ImmutableMap<String, Double>>> _counterValuesById;
    }
}
