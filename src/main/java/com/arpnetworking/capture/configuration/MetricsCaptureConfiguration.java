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
package com.arpnetworking.capture.configuration;

import com.arpnetworking.capture.models.ManagementSystem;
import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Representation of the metrics capture configuration.
 */
public final class MetricsCaptureConfiguration {
    /**
     * Create an {@link ObjectMapper} for metrics capture configuration.
     *
     * @return An {@link ObjectMapper} for metrics capture configuration.
     */
    public static ObjectMapper createObjectMapper() {
        return ObjectMapperFactory.getInstance();
    }

    public Duration getDefaultLookback() {
        return _defaultLookback;
    }

    public Duration getMaxRequestWindow() {
        return _maxRequestWindow;
    }

    public String getTargetDimension() {
        return _targetDimension;
    }

    public String getManagementSystemName() {
        return _managementSystemName;
    }

    public String getRegion() {
        return _region;
    }

    public Optional<URI> getEndpoint() {
        return _endpoint;
    }

    /**
     * The management system described by this configuration.
     *
     * @return The {@link ManagementSystem}.
     */
    public ManagementSystem getManagementSystem() {
        return new ManagementSystem.Builder()
                .setName(_managementSystemName)
                .setRegion(_region)
                .setEndpoint(_endpoint.orElse(null))
                .build();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("DefaultLookback", _defaultLookback)
                .add("MaxRequestWindow", _maxRequestWindow)
                .add("TargetDimension", _targetDimension)
                .add("ManagementSystemName", _managementSystemName)
                .add("Region", _region)
                .add("Endpoint", _endpoint)
                .toString();
    }

    private MetricsCaptureConfiguration(final Builder builder) {
        _defaultLookback = builder._defaultLookback;
        _maxRequestWindow = builder._maxRequestWindow;
        _targetDimension = builder._targetDimension;
        _managementSystemName = builder._managementSystemName;
        _region = builder._region;
        _endpoint = Optional.ofNullable(builder._endpoint);
    }

    private final Duration _defaultLookback;
    private final Duration _maxRequestWindow;
    private final String _targetDimension;
    private final String _managementSystemName;
    private final String _region;
    private final Optional<URI> _endpoint;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MetricsCaptureConfiguration}.
     */
    public static final class Builder extends OvalBuilder<MetricsCaptureConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MetricsCaptureConfiguration::new);
        }

        /**
         * The window captured when no start is given. Optional. Cannot be
         * null. Must be positive. Defaults to four hours.
         *
         * @param value The default lookback.
         * @return This instance of {@link Builder}.
         */
        public Builder setDefaultLookback(final Duration value) {
            _defaultLookback = value;
            return this;
        }

        /**
         * The longest window requested from the monitoring API in one call.
         * Optional. Cannot be null. Must be positive and at most one day.
         * Defaults to one day.
         *
         * @param value The maximum request window.
         * @return This instance of {@link Builder}.
         */
        public Builder setMaxRequestWindow(final Duration value) {
            _maxRequestWindow = value;
            return this;
        }

        /**
         * The dimension identifying a target in the monitoring API. Optional.
         * Cannot be null or empty. Defaults to {@code InstanceId}.
         *
         * @param value The target dimension.
         * @return This instance of {@link Builder}.
         */
        public Builder setTargetDimension(final String value) {
            _targetDimension = value;
            return this;
        }

        /**
         * The name of the management system. Optional. Cannot be null or
         * empty. Defaults to {@code cloudwatch}.
         *
         * @param value The management system name.
         * @return This instance of {@link Builder}.
         */
        public Builder setManagementSystemName(final String value) {
            _managementSystemName = value;
            return this;
        }

        /**
         * The region of the monitoring API. Optional. Cannot be null or
         * empty. Defaults to {@code us-east-1}.
         *
         * @param value The region.
         * @return This instance of {@link Builder}.
         */
        public Builder setRegion(final String value) {
            _region = value;
            return this;
        }

        /**
         * An endpoint overriding the one of the region. Optional.
         *
         * @param value The endpoint.
         * @return This instance of {@link Builder}.
         */
        public Builder setEndpoint(@Nullable final URI value) {
            _endpoint = value;
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateDefaultLookback(final Duration defaultLookback) {
            return !defaultLookback.isNegative() && !defaultLookback.isZero();
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateMaxRequestWindow(final Duration maxRequestWindow) {
            return !maxRequestWindow.isNegative()
                    && !maxRequestWindow.isZero()
                    && maxRequestWindow.compareTo(Duration.ofDays(1)) <= 0;
        }

        @NotNull
        @ValidateWithMethod(methodName = "validateDefaultLookback", parameterType = Duration.class)
        private Duration _defaultLookback = Duration.ofHours(4);
        @NotNull
        @ValidateWithMethod(methodName = "validateMaxRequestWindow", parameterType = Duration.class)
        private Duration _maxRequestWindow = Duration.ofDays(1);
        @NotNull
        @NotEmpty
        private String _targetDimension = "InstanceId";
        @NotNull
        @NotEmpty
        private String _managementSystemName = "cloudwatch";
        @NotNull
        @NotEmpty
        private String _region = "us-east-1";
        @Nullable
        private URI _endpoint;
    }
}
