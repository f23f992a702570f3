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

import ch.qos.logback.classic.LoggerContext;
import com.arpnetworking.capture.configuration.ConfigurationLoader;
import com.arpnetworking.capture.configuration.MetricsCaptureConfiguration;
import com.arpnetworking.capture.models.MonitoredTarget;
import com.arpnetworking.capture.output.CaptureResult;
import com.arpnetworking.steno.Logger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import javax.annotation.Nullable;

/**
 * Command line entry point. Captures one target and writes the result as JSON
 * to standard out.
 *
 * <p>Usage: {@code Main <config-file> <target-id> [<start-iso8601> [<end-iso8601>]]}</p>
 */
public final class Main {
    /**
     * Entry point.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        Thread.setDefaultUncaughtExceptionHandler(
                (thread, throwable) -> {
                    LOGGER.error()
                            .setMessage("Unhandled exception!")
                            .addData("thread", thread.getName())
                            .setThrowable(throwable)
                            .log();
                }
        );

        Thread.currentThread().setUncaughtExceptionHandler(
                (thread, throwable) -> {
                    LOGGER.error()
                            .setMessage("Unhandled exception!")
                            .setThrowable(throwable)
                            .log();
                }
        );

        if (args.length < 2 || args.length > 4) {
            throw new IllegalArgumentException(USAGE);
        }

        try {
            final ObjectMapper objectMapper = MetricsCaptureConfiguration.createObjectMapper();
            final MetricsCaptureConfiguration configuration = new ConfigurationLoader(objectMapper).load(new File(args[0]));
            final Injector injector = Guice.createInjector(new GuiceModule(configuration));

            final MonitoredTarget target = new MonitoredTarget.Builder()
                    .setId(args[1])
                    .setManagementSystem(configuration.getManagementSystem())
                    .build();
            final Instant start = args.length > 2 ? parseInstant(args[2]) : null;
            final Instant end = args.length > 3 ? parseInstant(args[3]) : null;

            final CaptureResult result = injector.getInstance(MetricsCapture.class).capture(target, start, end);
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (final JsonProcessingException e) {
            throw new RuntimeException(e);
        } finally {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.stop();
        }
    }

    private Main() {}

    @Nullable
    private static Instant parseInstant(final String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException(String.format("Invalid ISO-8601 instant; value=%s", value), e);
        }
    }

    private static final String USAGE = "Usage: Main <config-file> <target-id> [<start-iso8601> [<end-iso8601>]]";
    private static final Logger LOGGER = com.arpnetworking.steno.LoggerFactory.getLogger(Main.class);
}
