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
package com.arpnetworking.capture.fetch;

import com.arpnetworking.capture.client.MetricsApiClient;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tsdcore.model.MetricDescriptor;
import com.arpnetworking.tsdcore.model.RawSample;
import com.arpnetworking.tsdcore.model.RawSeries;
import com.arpnetworking.tsdcore.model.StatisticsRequest;
import com.arpnetworking.tsdcore.model.TimeWindow;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Retrieves the raw per-minute averages of a target from the monitoring API.
 *
 * <p>The requested window is widened by five minutes so that the first
 * interval of interest has a predecessor sample; the resampler discards the
 * first pair of every series because its cadence cannot be established. The
 * widened window is requested in sub-windows no longer than the maximum
 * request window since the API limits the number of datapoints returned by a
 * single call.</p>
 */
public final class MetricsFetcher {

    /**
     * Public constructor.
     *
     * @param client The monitoring API client.
     * @param maxRequestWindow The longest window requested in one call. Must be positive and at most one day.
     * @param targetDimension The dimension identifying the target in the monitoring API.
     */
    public MetricsFetcher(
            final MetricsApiClient client,
            final Duration maxRequestWindow,
            final String targetDimension) {
        Preconditions.checkArgument(
                !maxRequestWindow.isNegative() && !maxRequestWindow.isZero(),
                "Maximum request window must be positive; maxRequestWindow=%s",
                maxRequestWindow);
        Preconditions.checkArgument(
                maxRequestWindow.compareTo(MAX_REQUEST_WINDOW_LIMIT) <= 0,
                "Maximum request window cannot exceed one day; maxRequestWindow=%s",
                maxRequestWindow);
        _client = client;
        _maxRequestWindow = maxRequestWindow;
        _targetDimension = targetDimension;
    }

    /**
     * List the metrics the monitoring API has for a target, keeping only
     * those whose name is one of the given names.
     *
     * @param targetId The target identity in the monitoring API.
     * @param catalogNames The raw metric names of interest.
     * @return The matching metrics in listing order.
     */
    public CompletionStage<ImmutableList<MetricDescriptor>> listAvailableCounters(
            final String targetId,
            final Set<String> catalogNames) {
        return _client.listMetrics(ImmutableMap.of(_targetDimension, targetId))
                .thenApply(metrics -> {
                    final ImmutableList.Builder<MetricDescriptor> counters = ImmutableList.builder();
                    for (final MetricDescriptor metric : metrics) {
                        if (catalogNames.contains(metric.getMetricName())) {
                            counters.add(metric);
                        }
                    }
                    final ImmutableList<MetricDescriptor> available = counters.build();
                    LOGGER.debug()
                            .setMessage("Listed available counters")
                            .addData("targetId", targetId)
                            .addData("listed", metrics.size())
                            .addData("available", available.size())
                            .log();
                    return available;
                });
    }

    /**
     * Fetch the per-minute averages of each counter over the window widened
     * by five minutes.
     *
     * <p>All requests are issued concurrently. The samples are merged with
     * counters in the given order, then sub-windows in time order and then
     * samples in response order; a later sample replaces an earlier one with
     * the same metric name and timestamp. The first failed request fails the
     * returned stage with its cause and cancels the remaining requests.
     * Cancelling the returned stage cancels every outstanding request.</p>
     *
     * @param targetId The target identity in the monitoring API.
     * @param counters The metrics to fetch.
     * @param window The window of interest.
     * @return The merged series.
     */
    public CompletionStage<RawSeries> fetchSeries(
            final String targetId,
            final List<MetricDescriptor> counters,
            final TimeWindow window) {
        final ImmutableList<TimeWindow> subWindows = window.widen(FIRST_SAMPLE_PADDING).partition(_maxRequestWindow);
        LOGGER.debug()
                .setMessage("Fetching series")
                .addData("targetId", targetId)
                .addData("window", window)
                .addData("counters", counters.size())
                .addData("subWindows", subWindows.size())
                .log();

        final CompletableFuture<RawSeries> result = new CompletableFuture<>();
        final List<CompletableFuture<ImmutableList<RawSample>>> requests =
                Lists.newArrayListWithCapacity(counters.size() * subWindows.size());
        for (final MetricDescriptor counter : counters) {
            for (final TimeWindow subWindow : subWindows) {
                final StatisticsRequest request = new StatisticsRequest.Builder()
                        .setMetric(counter)
                        .setWindow(subWindow)
                        .setPeriod(PERIOD)
                        .setStatistic(STATISTIC)
                        .build();
                requests.add(_client.getMetricStatistics(request).toCompletableFuture());
            }
        }

        result.whenComplete((series, throwable) -> {
            if (result.isCancelled()) {
                cancelAll(requests);
            }
        });
        for (final CompletableFuture<ImmutableList<RawSample>> request : requests) {
            request.whenComplete((samples, throwable) -> {
                if (throwable != null && result.completeExceptionally(unwrap(throwable))) {
                    LOGGER.debug()
                            .setMessage("Statistics request failed; cancelling outstanding requests")
                            .addData("targetId", targetId)
                            .setThrowable(throwable)
                            .log();
                    cancelAll(requests);
                }
            });
        }
        CompletableFuture.allOf(requests.toArray(new CompletableFuture<?>[0]))
                .whenComplete((ignored, throwable) -> {
                    if (throwable == null) {
                        final RawSeries.Builder series = new RawSeries.Builder();
                        for (final CompletableFuture<ImmutableList<RawSample>> request : requests) {
                            series.addSamples(request.join());
                        }
                        final RawSeries merged = series.build();
                        LOGGER.debug()
                                .setMessage("Fetched series")
                                .addData("targetId", targetId)
                                .addData("series", merged)
                                .log();
                        result.complete(merged);
                    }
                });
        return result;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("maxRequestWindow", _maxRequestWindow)
                .put("targetDimension", _targetDimension)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private static void cancelAll(final List<CompletableFuture<ImmutableList<RawSample>>> requests) {
        for (final CompletableFuture<ImmutableList<RawSample>> request : requests) {
            request.cancel(true);
        }
    }

    private static Throwable unwrap(final Throwable throwable) {
        if (throwable instanceof CompletionException && throwable.getCause() != null) {
            return throwable.getCause();
        }
        return throwable;
    }

    private final MetricsApiClient _client;
    private final Duration _maxRequestWindow;
    private final String _targetDimension;

    private static final Duration FIRST_SAMPLE_PADDING = Duration.ofMinutes(5);
    private static final Duration MAX_REQUEST_WINDOW_LIMIT = Duration.ofDays(1);
    private static final Duration PERIOD = Duration.ofSeconds(60);
    private static final String STATISTIC = "Average";
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsFetcher.class);
}
