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
package com.arpnetworking.capture.models;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.net.URI;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The account and region through which the monitoring API of a target is
 * reached.
 */
@Loggable
public final class ManagementSystem {

    public String getName() {
        return _name;
    }

    public String getRegion() {
        return _region;
    }

    public Optional<URI> getEndpoint() {
        return _endpoint;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final ManagementSystem other = (ManagementSystem) object;

        return Objects.equal(_name, other._name)
                && Objects.equal(_region, other._region)
                && Objects.equal(_endpoint, other._endpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_name, _region, _endpoint);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Name", _name)
                .add("Region", _region)
                .add("Endpoint", _endpoint)
                .toString();
    }

    private ManagementSystem(final Builder builder) {
        _name = builder._name;
        _region = builder._region;
        _endpoint = Optional.ofNullable(builder._endpoint);
    }

    private final String _name;
    private final String _region;
    private final Optional<URI> _endpoint;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link ManagementSystem}.
     */
    public static final class Builder extends OvalBuilder<ManagementSystem> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ManagementSystem::new);
        }

        /**
         * Set the name. Required. Cannot be null or empty.
         *
         * @param value The name.
         * @return This {@link Builder} instance.
         */
        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        /**
         * Set the region. Required. Cannot be null or empty.
         *
         * @param value The region.
         * @return This {@link Builder} instance.
         */
        public Builder setRegion(final String value) {
            _region = value;
            return this;
        }

        /**
         * Set an endpoint overriding the one derived from the region. Optional.
         *
         * @param value The endpoint.
         * @return This {@link Builder} instance.
         */
        public Builder setEndpoint(@Nullable final URI value) {
            _endpoint = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _name;
        @NotNull
        @NotEmpty
        private String _region;
        @Nullable
        private URI _endpoint;
    }
}
