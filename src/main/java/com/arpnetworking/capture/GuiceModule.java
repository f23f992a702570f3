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
package com.arpnetworking.capture;

import com.arpnetworking.capture.catalog.CounterCatalog;
import com.arpnetworking.capture.client.CloudWatchApiClientFactory;
import com.arpnetworking.capture.client.MetricsApiClientFactory;
import com.arpnetworking.capture.configuration.MetricsCaptureConfiguration;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.time.Clock;

/**
 * The primary Guice module used to bootstrap metrics capture.
 */
public class GuiceModule extends AbstractModule {
    /**
     * Public constructor.
     *
     * @param configuration The configuration.
     */
    public GuiceModule(final MetricsCaptureConfiguration configuration) {
        _configuration = configuration;
    }

    @Override
    protected void configure() {
        bind(MetricsCaptureConfiguration.class).toInstance(_configuration);
        bind(MetricsApiClientFactory.class).to(CloudWatchApiClientFactory.class).in(Singleton.class);
        bind(MetricsCapture.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private CounterCatalog provideCounterCatalog() {
        return CounterCatalog.getDefault();
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private Clock provideClock() {
        return Clock.systemUTC();
    }

    private final MetricsCaptureConfiguration _configuration;
}
