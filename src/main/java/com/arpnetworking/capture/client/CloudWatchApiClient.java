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
package com.arpnetworking.capture.client;

import com.arpnetworking.capture.models.ManagementSystem;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tsdcore.model.MetricDescriptor;
import com.arpnetworking.tsdcore.model.RawSample;
import com.arpnetworking.tsdcore.model.StatisticsRequest;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.DimensionFilter;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.cloudwatch.model.ListMetricsRequest;
import software.amazon.awssdk.services.cloudwatch.model.ListMetricsResponse;
import software.amazon.awssdk.services.cloudwatch.model.Metric;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * {@link MetricsApiClient} backed by the CloudWatch asynchronous client of the
 * AWS SDK. The client is owned by this instance and closed with it.
 */
public final class CloudWatchApiClient implements MetricsApiClient {

    /**
     * Public constructor.
     *
     * @param cloudWatch The CloudWatch client.
     * @param managementSystem The management system the client is bound to.
     */
    public CloudWatchApiClient(final CloudWatchAsyncClient cloudWatch, final ManagementSystem managementSystem) {
        _cloudWatch = cloudWatch;
        _managementSystem = managementSystem;
    }

    @Override
    public CompletionStage<ImmutableList<MetricDescriptor>> listMetrics(final ImmutableMap<String, String> dimensionFilter) {
        final List<DimensionFilter> filters = dimensionFilter.entrySet()
                .stream()
                .map(entry -> DimensionFilter.builder().name(entry.getKey()).value(entry.getValue()).build())
                .collect(Collectors.toList());
        LOGGER.trace()
                .setMessage("Listing metrics")
                .addData("filter", dimensionFilter)
                .addData("managementSystem", _managementSystem.getName())
                .log();
        final CompletableFuture<ImmutableList<MetricDescriptor>> result = new CompletableFuture<>();
        requestMetricsPage(filters, null, ImmutableList.builder(), result);
        return result;
    }

    @Override
    public CompletionStage<ImmutableList<RawSample>> getMetricStatistics(final StatisticsRequest request) {
        final MetricDescriptor metric = request.getMetric();
        final GetMetricStatisticsRequest statisticsRequest = GetMetricStatisticsRequest.builder()
                .namespace(metric.getNamespace())
                .metricName(metric.getMetricName())
                .dimensions(toDimensions(metric.getDimensions()))
                .startTime(request.getWindow().getStart())
                .endTime(request.getWindow().getEnd())
                .period((int) request.getPeriod().getSeconds())
                .statisticsWithStrings(request.getStatistic())
                .build();
        LOGGER.trace()
                .setMessage("Getting metric statistics")
                .addData("request", request)
                .log();

        final CompletableFuture<ImmutableList<RawSample>> result = new CompletableFuture<>();
        final CompletableFuture<GetMetricStatisticsResponse> call;
        try {
            call = _cloudWatch.getMetricStatistics(statisticsRequest);
        } catch (final SdkException e) {
            result.completeExceptionally(wrap("Failed to get metric statistics", request, e));
            return result;
        }
        cancelWith(result, call);
        call.whenComplete((response, throwable) -> {
            if (throwable != null) {
                result.completeExceptionally(wrap("Failed to get metric statistics", request, throwable));
            } else {
                result.complete(toSamples(metric.getMetricName(), response));
            }
        });
        return result;
    }

    @Override
    public void close() {
        LOGGER.debug()
                .setMessage("Closing CloudWatch client")
                .addData("managementSystem", _managementSystem.getName())
                .log();
        _cloudWatch.close();
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("managementSystem", _managementSystem)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private void requestMetricsPage(
            final List<DimensionFilter> filters,
            @Nullable final String nextToken,
            final ImmutableList.Builder<MetricDescriptor> descriptors,
            final CompletableFuture<ImmutableList<MetricDescriptor>> result) {
        final ListMetricsRequest request = ListMetricsRequest.builder()
                .dimensions(filters)
                .nextToken(nextToken)
                .build();
        final CompletableFuture<ListMetricsResponse> page;
        try {
            page = _cloudWatch.listMetrics(request);
        } catch (final SdkException e) {
            result.completeExceptionally(wrap("Failed to list metrics", filters, e));
            return;
        }
        cancelWith(result, page);
        page.whenComplete((response, throwable) -> {
            if (throwable != null) {
                result.completeExceptionally(wrap("Failed to list metrics", filters, throwable));
                return;
            }
            for (final Metric metric : response.metrics()) {
                descriptors.add(toDescriptor(metric));
            }
            final String token = response.nextToken();
            if (Strings.isNullOrEmpty(token)) {
                result.complete(descriptors.build());
            } else if (!result.isDone()) {
                requestMetricsPage(filters, token, descriptors, result);
            }
        });
    }

    private static void cancelWith(final CompletableFuture<?> result, final CompletableFuture<?> call) {
        result.whenComplete((ignored, throwable) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
    }

    private static MetricDescriptor toDescriptor(final Metric metric) {
        final ImmutableMap.Builder<String, String> dimensions = ImmutableMap.builder();
        for (final Dimension dimension : metric.dimensions()) {
            dimensions.put(dimension.name(), dimension.value());
        }
        return new MetricDescriptor.Builder()
                .setNamespace(metric.namespace())
                .setMetricName(metric.metricName())
                .setDimensions(dimensions.buildKeepingLast())
                .build();
    }

    private static List<Dimension> toDimensions(final Map<String, String> dimensions) {
        return dimensions.entrySet()
                .stream()
                .map(entry -> Dimension.builder().name(entry.getKey()).value(entry.getValue()).build())
                .collect(Collectors.toList());
    }

    private static ImmutableList<RawSample> toSamples(final String metricName, final GetMetricStatisticsResponse response) {
        final ImmutableList.Builder<RawSample> samples = ImmutableList.builder();
        for (final Datapoint datapoint : response.datapoints()) {
            if (datapoint.average() == null) {
                LOGGER.warn()
                        .setMessage("Datapoint without an average")
                        .addData("metricName", metricName)
                        .addData("timestamp", datapoint.timestamp())
                        .log();
                continue;
            }
            samples.add(new RawSample.Builder()
                    .setMetricName(metricName)
                    .setTimestamp(datapoint.timestamp())
                    .setAverage(datapoint.average())
                    .build());
        }
        return samples.build();
    }

    private static MetricsTransportException wrap(final String message, final Object request, final Throwable throwable) {
        Throwable cause = throwable;
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof MetricsTransportException) {
            return (MetricsTransportException) cause;
        }
        return new MetricsTransportException(String.format("%s; request=%s", message, request), cause);
    }

    private final CloudWatchAsyncClient _cloudWatch;
    private final ManagementSystem _managementSystem;

    private static final Logger LOGGER = LoggerFactory.getLogger(CloudWatchApiClient.class);
}
