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
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClientBuilder;

/**
 * Creates a {@link CloudWatchApiClient} per management system. Credentials are
 * resolved by the default AWS provider chain.
 */
public final class CloudWatchApiClientFactory implements MetricsApiClientFactory {

    @Override
    public MetricsApiClient create(final ManagementSystem managementSystem) {
        final CloudWatchAsyncClientBuilder builder = CloudWatchAsyncClient.builder()
                .region(Region.of(managementSystem.getRegion()));
        managementSystem.getEndpoint().ifPresent(builder::endpointOverride);
        LOGGER.debug()
                .setMessage("Connecting to CloudWatch")
                .addData("managementSystem", managementSystem)
                .log();
        return new CloudWatchApiClient(builder.build(), managementSystem);
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(CloudWatchApiClientFactory.class);
}
