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
 * One value of a derived metric on the fine timestamp grid.
 */
@Loggable
public final class ResampledPoint {

    public Instant getTimestamp() {
        return _timestamp;
    }

    public String getDerivedKey() {
        return _derivedKey;
    }

    public double getValue() {
        return _value;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final ResampledPoint other = (ResampledPoint) object;

        return Double.compare(_value, other._value) == 0
                && Objects.equal(_timestamp, other._timestamp)
                && Objects.equal(_derivedKey, other._derivedKey);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_timestamp, _derivedKey, _value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Timestamp", _timestamp)
                .add("DerivedKey", _derivedKey)
                .add("Value", _value)
                .toString();
    }

    private ResampledPoint(final Builder builder) {
        _timestamp = builder._timestamp;
        _derivedKey = builder._derivedKey;
        _value = builder._value;
    }

    private final Instant _timestamp;
    private final String _derivedKey;
    private final double _value;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link ResampledPoint}.
     */
    public static final class Builder extends OvalBuilder<ResampledPoint> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ResampledPoint::new);
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
         * Set the derived metric key. Required. Cannot be null or empty.
         *
         * @param value The derived metric key.
         * @return This {@link Builder} instance.
         */
        public Builder setDerivedKey(final String value) {
            _derivedKey = value;
            return this;
        }

        /**
         * Set the value. Required. Cannot be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setValue(final Double value) {
            _value = value;
            return this;
        }

        @NotNull
        private Instant _timestamp;
        @NotNull
        @NotEmpty
        private String _derivedKey;
        @NotNull
        private Double _value;
    }
}
