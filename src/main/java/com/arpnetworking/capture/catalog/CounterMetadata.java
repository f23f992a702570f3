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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * Describes a derived metric to the performance history consumer. Every
 * derived metric is reported as a realtime sample with a 20 second capture
 * interval.
 */
@Loggable
@JsonPropertyOrder({
        "counter_key",
        "instance",
        "capture_interval",
        "precision",
        "rollup",
        "unit_key",
        "capture_interval_name"})
public final class CounterMetadata {

    @JsonProperty("counter_key")
    public String getCounterKey() {
        return _counterKey;
    }

    @JsonProperty("instance")
    public String getInstance() {
        return _instance;
    }

    @JsonProperty("capture_interval")
    public String getCaptureInterval() {
        return _captureInterval;
    }

    @JsonProperty("precision")
    public int getPrecision() {
        return _precision;
    }

    @JsonProperty("rollup")
    public String getRollup() {
        return _rollup;
    }

    @JsonProperty("unit_key")
    public String getUnitKey() {
        return _unitKey;
    }

    @JsonProperty("capture_interval_name")
    public String getCaptureIntervalName() {
        return _captureIntervalName;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final CounterMetadata other = (CounterMetadata) object;

        return _precision == other._precision
                && Objects.equal(_counterKey, other._counterKey)
                && Objects.equal(_instance, other._instance)
                && Objects.equal(_captureInterval, other._captureInterval)
                && Objects.equal(_rollup, other._rollup)
                && Objects.equal(_unitKey, other._unitKey)
                && Objects.equal(_captureIntervalName, other._captureIntervalName);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(
                _counterKey,
                _instance,
                _captureInterval,
                _precision,
                _rollup,
                _unitKey,
                _captureIntervalName);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("CounterKey", _counterKey)
                .add("Instance", _instance)
                .add("CaptureInterval", _captureInterval)
                .add("Precision", _precision)
                .add("Rollup", _rollup)
                .add("UnitKey", _unitKey)
                .add("CaptureIntervalName", _captureIntervalName)
                .toString();
    }

    private CounterMetadata(final Builder builder) {
        _counterKey = builder._counterKey;
        _instance = builder._instance;
        _captureInterval = builder._captureInterval;
        _precision = builder._precision;
        _rollup = builder._rollup;
        _unitKey = builder._unitKey;
        _captureIntervalName = builder._captureIntervalName;
    }

    private final String _counterKey;
    private final String _instance;
    private final String _captureInterval;
    private final int _precision;
    private final String _rollup;
    private final String _unitKey;
    private final String _captureIntervalName;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link CounterMetadata}.
     */
    public static final class Builder extends OvalBuilder<CounterMetadata> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(CounterMetadata::new);
        }

        /**
         * Set the counter key. Required. Cannot be null or empty.
         *
         * @param value The counter key.
         * @return This {@link Builder} instance.
         */
        public Builder setCounterKey(final String value) {
            _counterKey = value;
            return this;
        }

        /**
         * Set the instance. Optional. Cannot be null. Defaults to empty.
         *
         * @param value The instance.
         * @return This {@link Builder} instance.
         */
        public Builder setInstance(final String value) {
            _instance = value;
            return this;
        }

        /**
         * Set the capture interval in seconds. Optional. Cannot be null or
         * empty. Defaults to {@code 20}.
         *
         * @param value The capture interval.
         * @return This {@link Builder} instance.
         */
        public Builder setCaptureInterval(final String value) {
            _captureInterval = value;
            return this;
        }

        /**
         * Set the number of decimal places to keep. Required. Cannot be null
         * or negative.
         *
         * @param value The precision.
         * @return This {@link Builder} instance.
         */
        public Builder setPrecision(final Integer value) {
            _precision = value;
            return this;
        }

        /**
         * Set the rollup. Optional. Cannot be null or empty. Defaults to
         * {@code average}.
         *
         * @param value The rollup.
         * @return This {@link Builder} instance.
         */
        public Builder setRollup(final String value) {
            _rollup = value;
            return this;
        }

        /**
         * Set the unit key. Required. Cannot be null or empty.
         *
         * @param value The unit key.
         * @return This {@link Builder} instance.
         */
        public Builder setUnitKey(final String value) {
            _unitKey = value;
            return this;
        }

        /**
         * Set the capture interval name. Optional. Cannot be null or empty.
         * Defaults to {@code realtime}.
         *
         * @param value The capture interval name.
         * @return This {@link Builder} instance.
         */
        public Builder setCaptureIntervalName(final String value) {
            _captureIntervalName = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _counterKey;
        @NotNull
        private String _instance = "";
        @NotNull
        @NotEmpty
        private String _captureInterval = "20";
        @NotNull
        @Min(0)
        private Integer _precision;
        @NotNull
        @NotEmpty
        private String _rollup = "average";
        @NotNull
        @NotEmpty
        private String _unitKey;
        @NotNull
        @NotEmpty
        private String _captureIntervalName = "realtime";
    }
}
