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

/**
 * Raised when a call to the monitoring API fails. The underlying SDK or
 * transport failure is available as the cause.
 */
public final class MetricsTransportException extends RuntimeException {

    /**
     * Public constructor.
     *
     * @param message The detail message.
     * @param cause The underlying failure.
     */
    public MetricsTransportException(final String message, final Throwable cause) {
        super(message, cause);
    }

    private static final long serialVersionUID = 6912409238712351094L;
}
