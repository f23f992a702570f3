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

/**
 * Opens {@link MetricsApiClient} connections. The caller owns the returned
 * client and must close it.
 */
public interface MetricsApiClientFactory {

    /**
     * Open a client bound to a management system.
     *
     * @param managementSystem The management system.
     * @return A new {@link MetricsApiClient}.
     */
    MetricsApiClient create(ManagementSystem managementSystem);
}
