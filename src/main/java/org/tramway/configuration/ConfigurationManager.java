package org.tramway.configuration;

import lombok.extern.slf4j.Slf4j;
import org.tramway.exception.ConfigurationException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Layered configuration: classpath defaults, then an optional override file, then JVM system
 * properties with the same key.
 */
@Slf4j
public class ConfigurationManager {

    public static final String DEFAULT_RESOURCE = "tramway.properties";

    private final Properties properties;

    public ConfigurationManager(Properties properties) {
        this.properties = properties;
    }

    public static ConfigurationManager load() {
        return load(DEFAULT_RESOURCE, null);
    }

    public static ConfigurationManager load(String overridePath) {
        return load(DEFAULT_RESOURCE, overridePath);
    }

    public static ConfigurationManager load(String resource, String overridePath) {
        Properties properties = new Properties();

        try (InputStream input = ConfigurationManager.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                log.error("Configuration resource not found on classpath: {}", resource);
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            properties.load(input);
        } catch (IOException e) {
            log.error("Error loading configuration resource: {}", resource, e);
            throw new ConfigurationException("Error loading configuration resource.", e);
        }

        if (overridePath != null) {
            try (FileInputStream input = new FileInputStream(overridePath)) {
                properties.load(input);
                log.info("Loaded configuration overrides from {}", overridePath);
            } catch (FileNotFoundException e) {
                log.error("Configuration file not found: {}", overridePath, e);
                throw new ConfigurationException("Configuration file not found: " + overridePath, e);
            } catch (IOException e) {
                log.error("Error loading configuration file: {}", overridePath, e);
                throw new ConfigurationException("Error loading configuration file.", e);
            }
        }

        return new ConfigurationManager(properties);
    }

    public String getProperty(String key, String defaultValue) {
        String value = System.getProperty(key, properties.getProperty(key));
        if (value == null) {
            log.warn("Property {} not found in configuration. Using default value: {}", key, defaultValue);
            return defaultValue;
        }
        return value.trim();
    }

    public int getIntProperty(String key, int defaultValue) {
        String value = System.getProperty(key, properties.getProperty(key));
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid integer format for property: {}", key, e);
                throw new ConfigurationException("Invalid integer format for property: " + key, e);
            }
        } else {
            log.info("Using default value for property: {}", key);
        }
        return defaultValue;
    }

    public boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = System.getProperty(key, properties.getProperty(key));
        if (value == null) {
            log.info("Using default value for property: {}", key);
            return defaultValue;
        }
        String normalized = value.trim();
        if (!normalized.equalsIgnoreCase("true") && !normalized.equalsIgnoreCase("false")) {
            throw new ConfigurationException("Invalid boolean format for property: " + key);
        }
        return Boolean.parseBoolean(normalized);
    }

}
