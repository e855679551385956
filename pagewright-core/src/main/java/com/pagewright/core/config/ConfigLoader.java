package com.pagewright.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading compiler configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code pagewright.yaml} into {@link CompilerConfig}.
 * If the config file is missing or invalid, returns {@link CompilerConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CompilerConfig config = ConfigLoader.load(Paths.get("pagewright.yaml"));
 * Charset charset = config.writer().charset();
 * }</pre>
 */
public final class ConfigLoader {

    /** Conventional configuration file name */
    public static final String DEFAULT_FILE_NAME = "pagewright.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist, can't be parsed or names an unsupported encoding, logs a
     * warning and returns {@link CompilerConfig#defaults()}.
     *
     * @param configPath path to {@code pagewright.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CompilerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return CompilerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CompilerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CompilerConfig config = YAML_MAPPER.readValue(configPath.toFile(), CompilerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CompilerConfig.defaults();
            }
            try {
                config.writer().charset();
            } catch (IllegalArgumentException e) {
                log.warn("Unsupported writer encoding '{}' in {}. Using defaults.",
                    config.writer().encoding(), configPath);
                return CompilerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CompilerConfig.defaults();
        }
    }
}
