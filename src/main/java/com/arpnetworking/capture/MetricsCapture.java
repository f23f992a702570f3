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
import com.arpnetworking.capture.client.MetricsApiClient;
import com.arpnetworking.capture.client.MetricsApiClientFactory;
import com.arpnetworking.capture.configuration.MetricsCaptureConfiguration;
import com.arpnetworking.capture.fetch.MetricsFetcher;
import com.arpnetworking.capture.models.ManagementSystem;
import com.arpnetworking.capture.models.MonitoredTarget;
import com.arpnetworking.capture.output.CaptureResult;
import com.arpnetworking.capture.output.OutputAssembler;
import com.arpnetworking.capture.resample.IntervalResampler;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tsdcore.model.PointTable;
import com.arpnetworking.tsdcore.model.RawSeries;
import com.arpnetworking.tsdcore.model.TimeWindow;
import com.google.inject.Inject;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletionException;
import javax.annotation.Nullable;

/**
 * Captures the realtime performance samples of one target: lists the raw
 * counters the monitoring API has for it, fetches their series, resamples
 * them onto the fine grid and assembles the result. A connection to the
 * monitoring API is opened for each capture and closed when it completes.
 */
public final class MetricsCapture {

    /**
     * Public constructor.
     *
     * @param clientFactory Opens monitoring API connections.
     * @param catalog The derived metric definitions.
     * @param resampler The resampler.
     * @param assembler The output assembler.
     * @param configuration The configuration.
     * @param clock The clock supplying the default end of the window.
     */
    @Inject
    public MetricsCapture(
            final MetricsApiClientFactory clientFactory,
            final CounterCatalog catalog,
            final IntervalResampler resampler,
            final OutputAssembler assembler,
            final MetricsCaptureConfiguration configuration,
            final Clock clock) {
        _clientFactory = clientFactory;
        _catalog = catalog;
        _resampler = resampler;
        _assembler = assembler;
        _configuration = configuration;
        _clock = clock;
    }

    /**
     * Capture a target.
     *
     * @param target The target.
     * @param start The start of the window; defaults to the configured lookback before the end.
     * @param end The end of the window; defaults to now.
     * @return The {@link CaptureResult}.
     * @throws ConfigurationException if the target has no management system.
     */
    public CaptureResult capture(final MonitoredTarget target, @Nullable final Instant start, @Nullable final Instant end) {
        final ManagementSystem managementSystem = target.getManagementSystem()
                .orElseThrow(() -> new ConfigurationException(
                        String.format("No management system defined; target=%s", target.getId())));

        final Instant windowEnd = end == null ? _clock.instant() : end;
        final Instant windowStart = start == null ? windowEnd.minus(_configuration.getDefaultLookback()) : start;
        final TimeWindow window = new TimeWindow.Builder()
                .setStart(windowStart)
                .setEnd(windowEnd)
                .build();

        LOGGER.info()
                .setMessage("Capturing metrics")
                .addData("target", target)
                .addData("window", window)
                .log();

        try (MetricsApiClient client = _clientFactory.create(managementSystem)) {
            final MetricsFetcher fetcher = new MetricsFetcher(
                    client,
                    _configuration.getMaxRequestWindow(),
                    _configuration.getTargetDimension());
            final RawSeries series = fetcher.listAvailableCounters(target.getId(), _catalog.allRawNames())
                    .thenCompose(counters -> fetcher.fetchSeries(target.getId(), counters, window))
                    .toCompletableFuture()
                    .join();
            final PointTable points = _resampler.resample(_catalog, series);
            final CaptureResult result = _assembler.assemble(target.getId(), _catalog, points);
            LOGGER.info()
                    .setMessage("Captured metrics")
                    .addData("target", target)
                    .addData("rawSamples", series.getSampleCount())
                    .addData("points", points.size())
                    .log();
            return result;
        } catch (final CompletionException e) {
            final Throwable cause = e.getCause() == null ? e : e.getCause();
            logFailure(target, cause);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
            // CHECKSTYLE.OFF: IllegalCatch - Log the target before propagating
        } catch (final RuntimeException e) {
            // CHECKSTYLE.ON: IllegalCatch
            logFailure(target, e);
            throw e;
        }
    }

    private static void logFailure(final MonitoredTarget target, final Throwable throwable) {
        LOGGER.error()
                .setMessage("Unhandled exception during metrics capture")
                .addData("targetId", target.getId())
                .addData("targetName", target.getName())
                .addData("targetType", target.getType())
                .setThrowable(throwable)
                .log();
    }

    private final MetricsApiClientFactory _clientFactory;
    private final CounterCatalog _catalog;
    private final IntervalResampler _resampler;
    private final OutputAssembler _assembler;
    private final MetricsCaptureConfiguration _configuration;
    private final Clock _clock;

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsCapture.class);
}
