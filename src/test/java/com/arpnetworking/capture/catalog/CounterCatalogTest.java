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

import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.tsdcore.statistics.AggregationRule;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;
import java.util.Optional;

/**
 * Tests for the {@link CounterCatalog} class.
 */
public class CounterCatalogTest {

    @Test
    public void testDefaultRawNames() {
        Assert.assertEquals(
                ImmutableList.of(
                        "CPUUtilization",
                        "DiskReadBytes",
                        "DiskWriteBytes",
                        "NetworkIn",
                        "NetworkOut",
                        "MemoryUtilization",
                        "mem_used_percent",
                        "Memory % Committed Bytes In Use",
                        "SwapUtilization",
                        "swap_used_percent",
                        "Paging File % Usage"),
                CounterCatalog.getDefault().allRawNames().asList());
    }

    @Test
    public void testDefaultMetadata() {
        final ImmutableMap<String, CounterMetadata> metadata = CounterCatalog.getDefault().getMetadataByKey();
        Assert.assertEquals(
                ImmutableList.of(
                        "cpu_usage_rate_average",
                        "disk_usage_rate_average",
                        "net_usage_rate_average",
                        "mem_usage_absolute_average",
                        "mem_swapped_absolute_average"),
                metadata.keySet().asList());

        final CounterMetadata disk = metadata.get("disk_usage_rate_average");
        Assert.assertEquals("disk_usage_rate_average", disk.getCounterKey());
        Assert.assertEquals("", disk.getInstance());
        Assert.assertEquals("20", disk.getCaptureInterval());
        Assert.assertEquals(2, disk.getPrecision());
        Assert.assertEquals("average", disk.getRollup());
        Assert.assertEquals("kilobytespersecond", disk.getUnitKey());
        Assert.assertEquals("realtime", disk.getCaptureIntervalName());

        final CounterMetadata cpu = metadata.get("cpu_usage_rate_average");
        Assert.assertEquals(1, cpu.getPrecision());
        Assert.assertEquals("percent", cpu.getUnitKey());
    }

    @Test
    public void testMetadataSerialization() {
        final JsonNode node = ObjectMapperFactory.getInstance().valueToTree(
                CounterCatalog.getDefault().getMetadataByKey().get("net_usage_rate_average"));
        Assert.assertEquals("net_usage_rate_average", node.get("counter_key").asText());
        Assert.assertEquals("20", node.get("capture_interval").asText());
        Assert.assertEquals("realtime", node.get("capture_interval_name").asText());
        Assert.assertEquals("kilobytespersecond", node.get("unit_key").asText());
        Assert.assertEquals(2, node.get("precision").asInt());
    }

    @Test
    public void testComputeSumWithMissingSource() {
        final Optional<Double> value = CounterCatalog.getDefault().computeFor(
                "disk_usage_rate_average",
                ImmutableMap.of("DiskReadBytes", 10.0),
                Duration.ofMinutes(1));
        Assert.assertEquals(10.0 / 1024.0 / 60.0, value.get(), 1e-12);
    }

    @Test
    public void testComputeIgnoresUnrelatedMetrics() {
        final Optional<Double> value = CounterCatalog.getDefault().computeFor(
                "mem_usage_absolute_average",
                ImmutableMap.of("mem_used_percent", 40.0, "MemoryUtilization", 60.0, "CPUUtilization", 99.0),
                Duration.ofMinutes(5));
        Assert.assertEquals(50.0, value.get(), 1e-12);
    }

    @Test
    public void testComputeNoSources() {
        final Optional<Double> value = CounterCatalog.getDefault().computeFor(
                "net_usage_rate_average",
                ImmutableMap.of("CPUUtilization", 12.0),
                Duration.ofMinutes(1));
        Assert.assertFalse(value.isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testComputeUnknownKey() {
        CounterCatalog.getDefault().computeFor("gpu_usage_rate_average", ImmutableMap.of(), Duration.ofMinutes(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateKeys() {
        final DerivedMetricSpec spec = new DerivedMetricSpec.Builder()
                .setKey("cpu_usage_rate_average")
                .setSourceMetrics(ImmutableList.of("CPUUtilization"))
                .setRule(AggregationRule.MEAN)
                .setUnitKey("percent")
                .setPrecision(1)
                .build();
        new CounterCatalog(ImmutableList.of(spec, spec));
    }
}
