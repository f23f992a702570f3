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

import com.arpnetworking.test.TestBeanFactory;
import com.arpnetworking.tsdcore.model.MetricDescriptor;
import com.arpnetworking.tsdcore.model.RawSample;
import com.arpnetworking.tsdcore.model.StatisticsRequest;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.DimensionFilter;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.cloudwatch.model.ListMetricsRequest;
import software.amazon.awssdk.services.cloudwatch.model.ListMetricsResponse;
import software.amazon.awssdk.services.cloudwatch.model.Metric;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Tests for the {@link CloudWatchApiClient} class.
 */
public class CloudWatchApiClientTest {
    @Before
    public void setUp() {
        _openMocks = MockitoAnnotations.openMocks(this);
        _client = new CloudWatchApiClient(_cloudWatch, TestBeanFactory.createManagementSystemBuilder().build());
    }

    @After
    public void after() throws Exception {
        _openMocks.close();
    }

    @Test
    public void testListMetricsFollowsPages() throws Exception {
        Mockito.when(_cloudWatch.listMetrics(Mockito.any(ListMetricsRequest.class)))
                .thenReturn(
                        CompletableFuture.completedFuture(ListMetricsResponse.builder()
                                .metrics(createMetric("AWS/EC2", "CPUUtilization"))
                                .nextToken("page-2")
                                .build()),
                        CompletableFuture.completedFuture(ListMetricsResponse.builder()
                                .metrics(createMetric("CWAgent", "mem_used_percent"))
                                .build()));

        final ImmutableList<MetricDescriptor> metrics = _client.listMetrics(ImmutableMap.of("InstanceId", "i-1234"))
                .toCompletableFuture()
                .get();

        Assert.assertEquals(2, metrics.size());
        Assert.assertEquals("AWS/EC2", metrics.get(0).getNamespace());
        Assert.assertEquals("CPUUtilization", metrics.get(0).getMetricName());
        Assert.assertEquals(ImmutableMap.of("InstanceId", "i-1234"), metrics.get(0).getDimensions());
        Assert.assertEquals("mem_used_percent", metrics.get(1).getMetricName());

        final ArgumentCaptor<ListMetricsRequest> captor = ArgumentCaptor.forClass(ListMetricsRequest.class);
        Mockito.verify(_cloudWatch, Mockito.times(2)).listMetrics(captor.capture());
        final List<ListMetricsRequest> requests = captor.getAllValues();
        Assert.assertNull(requests.get(0).nextToken());
        Assert.assertEquals("page-2", requests.get(1).nextToken());
        Assert.assertEquals(
                ImmutableList.of(DimensionFilter.builder().name("InstanceId").value("i-1234").build()),
                requests.get(0).dimensions());
    }

    @Test
    public void testGetMetricStatistics() throws Exception {
        Mockito.when(_cloudWatch.getMetricStatistics(Mockito.any(GetMetricStatisticsRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(GetMetricStatisticsResponse.builder()
                        .label("NetworkIn")
                        .datapoints(
                                Datapoint.builder().timestamp(Instant.parse("2024-01-01T00:05:00Z")).average(300.0).build(),
                                Datapoint.builder().timestamp(Instant.parse("2024-01-01T00:00:00Z")).average(100.0).build())
                        .build()));
        final StatisticsRequest request = new StatisticsRequest.Builder()
                .setMetric(new MetricDescriptor.Builder()
                        .setNamespace("AWS/EC2")
                        .setMetricName("NetworkIn")
                        .setDimensions(ImmutableMap.of("InstanceId", "i-1234"))
                        .build())
                .setWindow(TestBeanFactory.createTimeWindow("2023-12-31T23:55:00Z", "2024-01-01T04:00:00Z"))
                .build();

        final ImmutableList<RawSample> samples = _client.getMetricStatistics(request).toCompletableFuture().get();

        Assert.assertEquals(
                ImmutableList.of(
                        TestBeanFactory.createRawSample("NetworkIn", "2024-01-01T00:05:00Z", 300.0),
                        TestBeanFactory.createRawSample("NetworkIn", "2024-01-01T00:00:00Z", 100.0)),
                samples);

        final ArgumentCaptor<GetMetricStatisticsRequest> captor = ArgumentCaptor.forClass(GetMetricStatisticsRequest.class);
        Mockito.verify(_cloudWatch).getMetricStatistics(captor.capture());
        final GetMetricStatisticsRequest sent = captor.getValue();
        Assert.assertEquals("AWS/EC2", sent.namespace());
        Assert.assertEquals("NetworkIn", sent.metricName());
        Assert.assertEquals(ImmutableList.of(Dimension.builder().name("InstanceId").value("i-1234").build()), sent.dimensions());
        Assert.assertEquals(Instant.parse("2023-12-31T23:55:00Z"), sent.startTime());
        Assert.assertEquals(Instant.parse("2024-01-01T04:00:00Z"), sent.endTime());
        Assert.assertEquals(Integer.valueOf(60), sent.period());
        Assert.assertEquals(ImmutableList.of(Statistic.AVERAGE), sent.statistics());
    }

    @Test
    public void testFailureIsWrapped() throws Exception {
        final SdkClientException sdkException = SdkClientException.builder().message("Unable to connect").build();
        final CompletableFuture<GetMetricStatisticsResponse> failed = new CompletableFuture<>();
        failed.completeExceptionally(sdkException);
        Mockito.when(_cloudWatch.getMetricStatistics(Mockito.any(GetMetricStatisticsRequest.class))).thenReturn(failed);
        final StatisticsRequest request = new StatisticsRequest.Builder()
                .setMetric(TestBeanFactory.createMetricDescriptor("NetworkIn"))
                .setWindow(TestBeanFactory.createTimeWindow("2024-01-01T00:00:00Z", "2024-01-01T04:00:00Z"))
                .build();

        try {
            _client.getMetricStatistics(request).toCompletableFuture().get();
            Assert.fail("Expected exception");
        } catch (final ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof MetricsTransportException);
            Assert.assertSame(sdkException, e.getCause().getCause());
        }
    }

    @Test
    public void testListMetricsFailureIsWrapped() throws Exception {
        final SdkClientException sdkException = SdkClientException.builder().message("Access denied").build();
        final CompletableFuture<ListMetricsResponse> failed = new CompletableFuture<>();
        failed.completeExceptionally(sdkException);
        Mockito.when(_cloudWatch.listMetrics(Mockito.any(ListMetricsRequest.class))).thenReturn(failed);

        try {
            _client.listMetrics(ImmutableMap.of("InstanceId", "i-1234")).toCompletableFuture().get();
            Assert.fail("Expected exception");
        } catch (final ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof MetricsTransportException);
            Assert.assertSame(sdkException, e.getCause().getCause());
        }
    }

    @Test
    public void testCancellationCancelsCall() {
        final CompletableFuture<GetMetricStatisticsResponse> pending = new CompletableFuture<>();
        Mockito.when(_cloudWatch.getMetricStatistics(Mockito.any(GetMetricStatisticsRequest.class))).thenReturn(pending);
        final StatisticsRequest request = new StatisticsRequest.Builder()
                .setMetric(TestBeanFactory.createMetricDescriptor("NetworkIn"))
                .setWindow(TestBeanFactory.createTimeWindow("2024-01-01T00:00:00Z", "2024-01-01T04:00:00Z"))
                .build();

        _client.getMetricStatistics(request).toCompletableFuture().cancel(true);

        Assert.assertTrue(pending.isCancelled());
    }

    @Test
    public void testClose() {
        _client.close();
        Mockito.verify(_cloudWatch).close();
    }

    private static Metric createMetric(final String namespace, final String name) {
        return Metric.builder()
                .namespace(namespace)
                .metricName(name)
                .dimensions(Dimension.builder().name("InstanceId").value("i-1234").build())
                .build();
    }

    @Mock
    private CloudWatchAsyncClient _cloudWatch;
    private CloudWatchApiClient _client;
    private AutoCloseable _openMocks;
}
