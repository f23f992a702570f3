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
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigRenderOptions;
import com.typesafe.config.ConfigSyntax;
import net.sf.oval.exception.ConstraintsViolatedException;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

/**
 * Loads a {@link MetricsCaptureConfiguration} from a HOCON or JSON file. Files
 * ending in {@code .conf} are parsed as HOCON with substitutions resolved;
 * any other file is parsed as JSON.
 */
public final class ConfigurationLoader {

    /**
     * Public constructor.
     *
     * @param objectMapper The mapper binding the parsed document to the configuration.
     */
    public ConfigurationLoader(final ObjectMapper objectMapper) {
        _objectMapper = objectMapper;
    }

    /**
     * Load the configuration.
     *
     * @param file The configuration file.
     * @return The {@link MetricsCaptureConfiguration}.
     * @throws ConfigurationException if the file cannot be read, parsed or bound.
     */
    public MetricsCaptureConfiguration load(final File file) {
        LOGGER.debug()
                .setMessage("Loading configuration from file")
                .addData("file", file)
                .log();
        if (!file.isFile()) {
            throw new ConfigurationException(String.format("Configuration file not found; file=%s", file));
        }
        try {
            final Config config = ConfigFactory.parseFile(file, ConfigParseOptions.defaults().setSyntax(syntaxOf(file)))
                    .resolve();
            final String json = config.root().render(ConfigRenderOptions.concise());
            final MetricsCaptureConfiguration configuration = _objectMapper.readValue(json, MetricsCaptureConfiguration.class);
            LOGGER.info()
                    .setMessage("Loaded configuration")
                    .addData("file", file)
                    .addData("configuration", configuration)
                    .log();
            return configuration;
        } catch (final ConfigException | IOException | ConstraintsViolatedException e) {
            throw new ConfigurationException(String.format("Invalid configuration; file=%s", file), e);
        }
    }

    private static ConfigSyntax syntaxOf(final File file) {
        if (file.getName().toLowerCase(Locale.getDefault()).endsWith(HOCON_FILE_EXTENSION)) {
            return ConfigSyntax.CONF;
        }
        return ConfigSyntax.JSON;
    }

    private final ObjectMapper _objectMapper;

    private static final String HOCON_FILE_EXTENSION = ".conf";
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationLoader.class);
}
