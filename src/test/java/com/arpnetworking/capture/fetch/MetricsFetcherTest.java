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
import com.arpnetworking.capture.client.MetricsTransportException;
import com.arpnetworking.test.TestBeanFactory;
import com.arpnetworking.tsdcore.model.MetricDescriptor;
import com.arpnetworking.tsdcore.model.RawSample;
import com.arpnetworking.tsdcore.model.RawSeries;
import com.arpnetworking.tsdcore.model.StatisticsRequest;
import com.arpnetworking.tsdcore.model.TimeWindow;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Tests for the {@link MetricsFetcher} class.
 */
public class MetricsFetcherTest {
    @Before
    public void setUp() {
        _openMocks = MockitoAnnotations.openMocks(this);
        _fetcher = new MetricsFetcher(_client, Duration.ofDays(1), "InstanceId");
    }

    @After
    public void after() throws Exception {
        _openMocks.close();
    }

    @Test
    public void testListAvailableCounters() throws Exception {
        final MetricDescriptor cpu = TestBeanFactory.createMetricDescriptor("CPUUtilization");
        final MetricDescriptor credits = TestBeanFactory.createMetricDescriptor("CPUCreditBalance");
        final MetricDescriptor network = TestBeanFactory.createMetricDescriptor("NetworkIn");
        Mockito.when(_client.listMetrics(ImmutableMap.of("InstanceId", "i-1234")))
                .thenReturn(CompletableFuture.completedFuture(ImmutableList.of(cpu, credits, network)));

        final List<MetricDescriptor> counters = _fetcher.listAvailableCounters(
                "i-1234",
                ImmutableSet.of("NetworkIn", "CPUUtilization"))
                .toCompletableFuture()
                .get();

        Assert.assertEquals(ImmutableList.of(cpu, network), counters);
    }

    @Test
    public void testRequestsAreWidenedAndChunked() throws Exception {
        Mockito.when(_client.getMetricStatistics(Mockito.any(StatisticsRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(ImmutableList.of()));
        final MetricDescriptor network = TestBeanFactory.createMetricDescriptor("NetworkIn");

        _fetcher.fetchSeries(
                "i-1234",
                ImmutableList.of(network),
                TestBeanFactory.createTimeWindow("2024-01-01T00:00:00Z", "2024-01-04T00:00:00Z"))
                .toCompletableFuture()
                .get();

        final ArgumentCaptor<StatisticsRequest> captor = ArgumentCaptor.forClass(StatisticsRequest.class);
        Mockito.verify(_client, Mockito.times(4)).getMetricStatistics(captor.capture());
        final List<StatisticsRequest> requests = captor.getAllValues();
        Assert.assertEquals(Instant.parse("2023-12-31T23:55:00Z"), requests.get(0).getWindow().getStart());
        Assert.assertEquals(Instant.parse("2024-01-03T23:55:00Z"), requests.get(3).getWindow().getStart());
        Assert.assertEquals(Instant.parse("2024-01-04T00:00:00Z"), requests.get(3).getWindow().getEnd());
        for (final StatisticsRequest request : requests) {
            Assert.assertEquals(network, request.getMetric());
            Assert.assertEquals(Duration.ofSeconds(60), request.getPeriod());
            Assert.assertEquals("Average", request.getStatistic());
            Assert.assertTrue(request.getWindow().getDuration().compareTo(Duration.ofDays(1)) <= 0);
        }
    }

    @Test
    public void testChunkedFetchMatchesWholeSeries() throws Exception {
        final TimeWindow window = TestBeanFactory.createTimeWindow("2024-01-01T00:00:00Z", "2024-01-04T00:00:00Z");
        final RawSeries.Builder expected = new RawSeries.Builder();
        for (Instant timestamp = Instant.parse("2023-12-31T23:55:00Z");
                timestamp.isBefore(window.getEnd());
                timestamp = timestamp.plus(Duration.ofMinutes(5))) {
            expected.addSample(new RawSample.Builder()
                    .setMetricName("NetworkIn")
                    .setTimestamp(timestamp)
                    .setAverage((double) timestamp.getEpochSecond() % 7919)
                    .build());
        }
        final RawSeries whole = expected.build();
        Mockito.when(_client.getMetricStatistics(Mockito.any(StatisticsRequest.class))).thenAnswer(invocation -> {
            final StatisticsRequest request = invocation.getArgument(0);
            final ImmutableList.Builder<RawSample> samples = ImmutableList.builder();
            for (final Map.Entry<Instant, Double> entry : whole.getSeries(request.getMetric().getMetricName()).entrySet()) {
                if (!entry.getKey().isBefore(request.getWindow().getStart()) && entry.getKey().isBefore(request.getWindow().getEnd())) {
                    samples.add(new RawSample.Builder()
                            .setMetricName(request.getMetric().getMetricName())
                            .setTimestamp(entry.getKey())
                            .setAverage(entry.getValue())
                            .build());
                }
            }
            return CompletableFuture.completedFuture(samples.build());
        });

        final RawSeries fetched = _fetcher.fetchSeries(
                "i-1234",
                ImmutableList.of(TestBeanFactory.createMetricDescriptor("NetworkIn")),
                window)
                .toCompletableFuture()
                .get();

        Assert.assertEquals(865, fetched.getSampleCount());
        Assert.assertEquals(whole, fetched);
    }

    @Test
    public void testLaterDescriptorWins() throws Exception {
        final MetricDescriptor first = TestBeanFactory.createMetricDescriptor("mem_used_percent");
        final MetricDescriptor second = TestBeanFactory.createMetricDescriptorBuilder()
                .setNamespace("CWAgent")
                .setMetricName("mem_used_percent")
                .build();
        final CompletableFuture<ImmutableList<RawSample>> firstResponse = new CompletableFuture<>();
        final CompletableFuture<ImmutableList<RawSample>> secondResponse = new CompletableFuture<>();
        Mockito.when(_client.getMetricStatistics(Mockito.any(StatisticsRequest.class)))
                .thenReturn(firstResponse, secondResponse);

        final CompletableFuture<RawSeries> result = _fetcher.fetchSeries(
                "i-1234",
                ImmutableList.of(first, second),
                TestBeanFactory.createTimeWindow("2024-01-01T00:00:00Z", "2024-01-01T04:00:00Z"))
                .toCompletableFuture();
        // Completion order does not affect the merge order
        secondResponse.complete(ImmutableList.of(TestBeanFactory.createRawSample("mem_used_percent", "2024-01-01T00:01:00Z", 2.0)));
        firstResponse.complete(ImmutableList.of(TestBeanFactory.createRawSample("mem_used_percent", "2024-01-01T00:01:00Z", 1.0)));

        Assert.assertEquals(
                Double.valueOf(2.0),
                result.get().getValue("mem_used_percent", Instant.parse("2024-01-01T00:01:00Z")).get());
    }

    @Test
    public void testNoCounters() throws Exception {
        final RawSeries series = _fetcher.fetchSeries(
                "i-1234",
                ImmutableList.of(),
                TestBeanFactory.createTimeWindow("2024-01-01T00:00:00Z", "2024-01-01T04:00:00Z"))
                .toCompletableFuture()
                .get();
        Assert.assertTrue(series.isEmpty());
        Mockito.verifyNoInteractions(_client);
    }

    @Test
    public void testFailurePropagatesAndCancelsOutstanding() throws Exception {
        final MetricsTransportException failure = new MetricsTransportException("Throttled", new RuntimeException("Rate exceeded"));
        final CompletableFuture<ImmutableList<RawSample>> pending = new CompletableFuture<>();
        final CompletableFuture<ImmutableList<RawSample>> failed = new CompletableFuture<>();
        Mockito.when(_client.getMetricStatistics(Mockito.any(StatisticsRequest.class)))
                .thenReturn(pending, failed);

        final CompletableFuture<RawSeries> result = _fetcher.fetchSeries(
                "i-1234",
                ImmutableList.of(
                        TestBeanFactory.createMetricDescriptor("NetworkIn"),
                        TestBeanFactory.createMetricDescriptor("NetworkOut")),
                TestBeanFactory.createTimeWindow("2024-01-01T00:00:00Z", "2024-01-01T04:00:00Z"))
                .toCompletableFuture();
        failed.completeExceptionally(failure);

        try {
            result.get();
            Assert.fail("Expected exception");
        } catch (final ExecutionException e) {
            Assert.assertSame(failure, e.getCause());
        }
        Assert.assertTrue(pending.isCancelled());
    }

    @Test
    public void testCancellationCancelsOutstanding() {
        final CompletableFuture<ImmutableList<RawSample>> pending = new CompletableFuture<>();
        Mockito.when(_client.getMetricStatistics(Mockito.any(StatisticsRequest.class))).thenReturn(pending);

        final CompletableFuture<RawSeries> result = _fetcher.fetchSeries(
                "i-1234",
                ImmutableList.of(TestBeanFactory.createMetricDescriptor("NetworkIn")),
                TestBeanFactory.createTimeWindow("2024-01-01T00:00:00Z", "2024-01-01T04:00:00Z"))
                .toCompletableFuture();
        result.cancel(true);

        Assert.assertTrue(pending.isCancelled());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRequestWindowLongerThanOneDay() {
        new MetricsFetcher(_client, Duration.ofHours(25), "InstanceId");
    }

    @Mock
    private MetricsApiClient _client;
    private MetricsFetcher _fetcher;
    private AutoCloseable _openMocks;
}
