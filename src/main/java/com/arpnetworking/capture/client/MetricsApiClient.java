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

import com.arpnetworking.tsdcore.model.MetricDescriptor;
import com.arpnetworking.tsdcore.model.RawSample;
import com.arpnetworking.tsdcore.model.StatisticsRequest;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous access to a monitoring API. Failures complete the returned
 * stages exceptionally with a {@link MetricsTransportException}. Cancelling a
 * returned stage abandons the underlying call.
 */
public interface MetricsApiClient extends AutoCloseable {

    /**
     * List the metrics which carry every dimension in the filter. All pages
     * of the listing are returned.
     *
     * @param dimensionFilter Dimension name to value.
     * @return The matching metrics in listing order.
     */
    CompletionStage<ImmutableList<MetricDescriptor>> listMetrics(ImmutableMap<String, String> dimensionFilter);

    /**
     * Retrieve the statistics of one metric over one window.
     *
     * @param request The request.
     * @return The samples in response order.
     */
    CompletionStage<ImmutableList<RawSample>> getMetricStatistics(StatisticsRequest request);

    /**
     * Release the connection.
     */
    @Override
    void close();
}
