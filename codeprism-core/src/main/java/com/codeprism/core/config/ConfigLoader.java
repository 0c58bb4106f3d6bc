package com.codeprism.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading CodePrism configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code codeprism.yaml} into {@link AnalyzerConfig} records.
 * If the config file is missing, unreadable or not valid YAML, returns
 * {@link AnalyzerConfig#defaults()}. Values that parse but are out of range
 * (negative weights, weights not adding up to 1) are rejected.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalyzerConfig config = ConfigLoader.load(Paths.get("codeprism.yaml"));
 * double multiplier = config.complexity().cognitiveMultiplier();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "codeprism.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code codeprism.yaml}
     * @return loaded configuration or defaults if unavailable
     * @throws IllegalArgumentException if the file holds out-of-range values
     */
    public static AnalyzerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AnalyzerConfig config = YAML_MAPPER.readValue(configPath.toFile(), AnalyzerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AnalyzerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (ValueInstantiationException e) {
            if (e.getCause() instanceof IllegalArgumentException invalid) {
                throw new IllegalArgumentException(
                    "Invalid configuration in " + configPath + ": " + invalid.getMessage(), invalid);
            }
            log.warn("Failed to read configuration file: {}. Using defaults. Error: {}", configPath, e.getMessage());
            return AnalyzerConfig.defaults();
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AnalyzerConfig.defaults();
        }
    }

    /**
     * Renders a configuration as YAML, used to write a starter file.
     *
     * @param config configuration to render
     * @return YAML text
     */
    public static String toYaml(AnalyzerConfig config) {
        try {
            return YAML_MAPPER.writeValueAsString(config);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render configuration as YAML", e);
        }
    }
}
