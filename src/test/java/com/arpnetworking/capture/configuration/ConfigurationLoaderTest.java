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
package com.arpnetworking.capture.configuration;

import com.arpnetworking.capture.ConfigurationException;
import com.arpnetworking.capture.models.ManagementSystem;
import org.junit.Assert;
import org.junit.Test;

import java.io.File;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Optional;

/**
 * Tests for the {@link ConfigurationLoader} class.
 */
public class ConfigurationLoaderTest {

    @Test
    public void testLoadHocon() throws URISyntaxException {
        final MetricsCaptureConfiguration configuration = _loader.load(getResourceFile("capture.conf"));
        Assert.assertEquals(Duration.ofHours(2), configuration.getDefaultLookback());
        Assert.assertEquals(Duration.ofHours(12), configuration.getMaxRequestWindow());
        Assert.assertEquals("InstanceId", configuration.getTargetDimension());

        final ManagementSystem managementSystem = configuration.getManagementSystem();
        Assert.assertEquals("test-account", managementSystem.getName());
        Assert.assertEquals("us-west-2", managementSystem.getRegion());
        Assert.assertEquals(Optional.of(URI.create("http://localhost:4566")), managementSystem.getEndpoint());
    }

    @Test
    public void testLoadJsonDefaults() throws URISyntaxException {
        final MetricsCaptureConfiguration configuration = _loader.load(getResourceFile("capture-defaults.json"));
        Assert.assertEquals(Duration.ofHours(4), configuration.getDefaultLookback());
        Assert.assertEquals(Duration.ofDays(1), configuration.getMaxRequestWindow());
        Assert.assertEquals("InstanceId", configuration.getTargetDimension());
        Assert.assertEquals("eu-west-1", configuration.getRegion());
        Assert.assertFalse(configuration.getEndpoint().isPresent());
    }

    @Test(expected = ConfigurationException.class)
    public void testRequestWindowLongerThanOneDay() throws URISyntaxException {
        _loader.load(getResourceFile("capture-invalid.conf"));
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingFile() {
        _loader.load(new File("does-not-exist.conf"));
    }

    private File getResourceFile(final String name) throws URISyntaxException {
        return new File(getClass().getClassLoader().getResource(name).toURI());
    }

    private final ConfigurationLoader _loader = new ConfigurationLoader(MetricsCaptureConfiguration.createObjectMapper());
}
