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

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A resource whose performance is captured. The identifier is the one the
 * monitoring API uses for the resource, for example an EC2 instance id.
 */
@Loggable
public final class MonitoredTarget {

    public String getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    public String getType() {
        return _type;
    }

    public Optional<ManagementSystem> getManagementSystem() {
        return _managementSystem;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final MonitoredTarget other = (MonitoredTarget) object;

        return Objects.equal(_id, other._id)
                && Objects.equal(_name, other._name)
                && Objects.equal(_type, other._type)
                && Objects.equal(_managementSystem, other._managementSystem);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_id, _name, _type, _managementSystem);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Id", _id)
                .add("Name", _name)
                .add("Type", _type)
                .add("ManagementSystem", _managementSystem)
                .toString();
    }

    private MonitoredTarget(final Builder builder) {
        _id = builder._id;
        _name = builder._name == null ? builder._id : builder._name;
        _type = builder._type;
        _managementSystem = Optional.ofNullable(builder._managementSystem);
    }

    private final String _id;
    private final String _name;
    private final String _type;
    private final Optional<ManagementSystem> _managementSystem;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MonitoredTarget}.
     */
    public static final class Builder extends OvalBuilder<MonitoredTarget> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MonitoredTarget::new);
        }

        /**
         * Set the identifier. Required. Cannot be null or empty.
         *
         * @param value The identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setId(final String value) {
            _id = value;
            return this;
        }

        /**
         * Set the display name. Optional. Cannot be empty. Defaults to the identifier.
         *
         * @param value The name.
         * @return This {@link Builder} instance.
         */
        public Builder setName(@Nullable final String value) {
            _name = value;
            return this;
        }

        /**
         * Set the type. Optional. Cannot be null or empty. Defaults to {@code Vm}.
         *
         * @param value The type.
         * @return This {@link Builder} instance.
         */
        public Builder setType(final String value) {
            _type = value;
            return this;
        }

        /**
         * Set the management system. Optional. A target without one cannot be captured.
         *
         * @param value The management system.
         * @return This {@link Builder} instance.
         */
        public Builder setManagementSystem(@Nullable final ManagementSystem value) {
            _managementSystem = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _id;
        @NotEmpty
        private String _name;
        @NotNull
        @NotEmpty
        private String _type = "Vm";
        @Nullable
        private ManagementSystem _managementSystem;
    }
}
