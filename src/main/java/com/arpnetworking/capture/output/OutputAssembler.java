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
package com.arpnetworking.capture.output;

import com.arpnetworking.capture.catalog.CounterCatalog;
import com.arpnetworking.tsdcore.model.PointTable;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Packages the catalog metadata and the derived points of a target into a
 * {@link CaptureResult}.
 */
public final class OutputAssembler {

    /**
     * Assemble the result of one target. The value table is ordered by
     * ascending timestamp and is present, possibly empty, even when no point
     * was derived.
     *
     * @param targetId The target identity.
     * @param catalog The derived metric definitions.
     * @param points The derived points.
     * @return The {@link CaptureResult}.
     */
    public CaptureResult assemble(final String targetId, final CounterCatalog catalog, final PointTable points) {
        final ImmutableMap.Builder<String, ImmutableMap<String, Double>> valuesByTimestamp = ImmutableMap.builder();
        for (final Map.Entry<Instant, ImmutableSortedMap<String, Double>> entry : points.getValuesByTimestamp().entrySet()) {
            valuesByTimestamp.put(DateTimeFormatter.ISO_INSTANT.format(entry.getKey()), entry.getValue());
        }
        return new CaptureResult.Builder()
                .setCountersById(ImmutableMap.of(targetId, catalog.getMetadataByKey()))
                .setCounterValuesById(ImmutableMap.of(targetId, valuesByTimestamp.build()))
                .build();
    }
}
