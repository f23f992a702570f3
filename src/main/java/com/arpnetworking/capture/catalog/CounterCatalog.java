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
package com.arpnetworking.capture.catalog;

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.tsdcore.statistics.AggregationRule;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the derived metrics reported downstream, the raw metrics each
 * is computed from and how they are combined.
 */
public final class CounterCatalog {

    /**
     * The catalog of instance metrics published by EC2 and the CloudWatch
     * agent (Linux and Windows).
     *
     * @return The default {@link CounterCatalog}.
     */
    public static CounterCatalog getDefault() {
        return DEFAULT;
    }

    /**
     * Public constructor.
     *
     * @param specs The derived metric definitions. Keys must be unique.
     */
    public CounterCatalog(final ImmutableList<DerivedMetricSpec> specs) {
        final ImmutableMap.Builder<String, DerivedMetricSpec> specsByKey = ImmutableMap.builder();
        final ImmutableSet.Builder<String> rawNames = ImmutableSet.builder();
        for (final DerivedMetricSpec spec : specs) {
            specsByKey.put(spec.getKey(), spec);
            rawNames.addAll(spec.getSourceMetrics());
        }
        try {
            _specsByKey = specsByKey.buildOrThrow();
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Derived metric keys must be unique", e);
        }
        _specs = specs;
        _rawNames = rawNames.build();
    }

    public ImmutableList<DerivedMetricSpec> getSpecs() {
        return _specs;
    }

    /**
     * Look up a derived metric.
     *
     * @param derivedKey The derived metric key.
     * @return The {@link DerivedMetricSpec}.
     * @throws IllegalArgumentException if the key is not in the catalog.
     */
    public DerivedMetricSpec getSpec(final String derivedKey) {
        final DerivedMetricSpec spec = _specsByKey.get(derivedKey);
        if (spec == null) {
            throw new IllegalArgumentException(String.format("Unknown derived metric; key=%s", derivedKey));
        }
        return spec;
    }

    /**
     * Every raw metric name needed by any derived metric, without duplicates,
     * in catalog order.
     *
     * @return The raw metric names.
     */
    public ImmutableSet<String> allRawNames() {
        return _rawNames;
    }

    /**
     * The downstream metadata of every derived metric keyed by derived key.
     *
     * @return The metadata in catalog order.
     */
    public ImmutableMap<String, CounterMetadata> getMetadataByKey() {
        final ImmutableMap.Builder<String, CounterMetadata> metadata = ImmutableMap.builder();
        for (final DerivedMetricSpec spec : _specs) {
            metadata.put(spec.getKey(), spec.getMetadata());
        }
        return metadata.build();
    }

    /**
     * Compute a derived value from the raw values reported at one timestamp.
     * Raw values of metrics that are not sources of the derived metric are
     * ignored.
     *
     * @param derivedKey The derived metric key.
     * @param valuesAtTimestamp Raw values by raw metric name; absent names did not report.
     * @param gap The length of the interval ending at the timestamp.
     * @return The derived value; empty if none of the sources reported.
     */
    public Optional<Double> computeFor(
            final String derivedKey,
            final Map<String, Double> valuesAtTimestamp,
            final Duration gap) {
        final DerivedMetricSpec spec = getSpec(derivedKey);
        final List<Double> presentValues = Lists.newArrayListWithCapacity(spec.getSourceMetrics().size());
        for (final String source : spec.getSourceMetrics()) {
            final Double value = valuesAtTimestamp.get(source);
            if (value != null) {
                presentValues.add(value);
            }
        }
        return spec.getRule().aggregate(presentValues, gap);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("derivedKeys", _specsByKey.keySet())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final ImmutableList<DerivedMetricSpec> _specs;
    private final ImmutableMap<String, DerivedMetricSpec> _specsByKey;
    private final ImmutableSet<String> _rawNames;

    private static final String PERCENT = "percent";
    private static final String KILOBYTES_PER_SECOND = "kilobytespersecond";

    private static final CounterCatalog DEFAULT = new CounterCatalog(ImmutableList.of(
            new DerivedMetricSpec.Builder()
                    .setKey("cpu_usage_rate_average")
                    .setSourceMetrics(ImmutableList.of("CPUUtilization"))
                    .setRule(AggregationRule.MEAN)
                    .setUnitKey(PERCENT)
                    .setPrecision(1)
                    .build(),
            new DerivedMetricSpec.Builder()
                    .setKey("disk_usage_rate_average")
                    .setSourceMetrics(ImmutableList.of("DiskReadBytes", "DiskWriteBytes"))
                    .setRule(AggregationRule.SCALED_SUM_RATE)
                    .setUnitKey(KILOBYTES_PER_SECOND)
                    .setPrecision(2)
                    .build(),
            new DerivedMetricSpec.Builder()
                    .setKey("net_usage_rate_average")
                    .setSourceMetrics(ImmutableList.of("NetworkIn", "NetworkOut"))
                    .setRule(AggregationRule.SCALED_SUM_RATE)
                    .setUnitKey(KILOBYTES_PER_SECOND)
                    .setPrecision(2)
                    .build(),
            new DerivedMetricSpec.Builder()
                    .setKey("mem_usage_absolute_average")
                    .setSourceMetrics(ImmutableList.of(
                            "MemoryUtilization",
                            "mem_used_percent", // Linux agent
                            "Memory % Committed Bytes In Use")) // Windows agent
                    .setRule(AggregationRule.MEAN)
                    .setUnitKey(PERCENT)
                    .setPrecision(1)
                    .build(),
            new DerivedMetricSpec.Builder()
                    .setKey("mem_swapped_absolute_average")
                    .setSourceMetrics(ImmutableList.of(
                            "SwapUtilization",
                            "swap_used_percent", // Linux agent
                            // TODO: The mean is wrong for Windows hosts with more than one paging file.
                            "Paging File % Usage")) // Windows agent
                    .setRule(AggregationRule.MEAN)
                    .setUnitKey(PERCENT)
                    .setPrecision(1)
                    .build()));
}
