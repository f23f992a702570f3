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
package com.arpnetworking.tsdcore.statistics;

import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;

/**
 * Tests for the {@link AggregationRule} enumeration.
 */
public class AggregationRuleTest {

    @Test
    public void testScaledSumRate() {
        final Optional<Double> value = AggregationRule.SCALED_SUM_RATE.aggregate(
                ImmutableList.of(100.0, 200.0),
                Duration.ofMinutes(5));
        Assert.assertEquals(300.0 / 1024.0 / 300.0, value.get(), 1e-12);
    }

    @Test
    public void testScaledSumRateZero() {
        final Optional<Double> value = AggregationRule.SCALED_SUM_RATE.aggregate(
                ImmutableList.of(0.0, 0.0),
                Duration.ofMinutes(1));
        Assert.assertEquals(Optional.of(0.0), value);
    }

    @Test
    public void testMean() {
        final Optional<Double> value = AggregationRule.MEAN.aggregate(
                ImmutableList.of(10.0, 20.0, 60.0),
                Duration.ofMinutes(1));
        Assert.assertEquals(30.0, value.get(), 1e-12);
    }

    @Test
    public void testNoValues() {
        Assert.assertEquals(Optional.empty(), AggregationRule.SCALED_SUM_RATE.aggregate(Collections.emptyList(), Duration.ofMinutes(1)));
        Assert.assertEquals(Optional.empty(), AggregationRule.MEAN.aggregate(Collections.emptyList(), Duration.ofMinutes(1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveInterval() {
        AggregationRule.SCALED_SUM_RATE.aggregate(ImmutableList.of(1.0), Duration.ZERO);
    }
}
