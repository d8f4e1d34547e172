package io.prime.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.prime.core.exception.ConfigurationException;
import io.prime.core.registry.DriverRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/// Loads and writes driver registries as JSON rule-set documents.
///
/// A parsed registry goes through the same validation as the built-in one; every failure,
/// structural or semantic, is reported as a `ConfigurationException`.
///
/// {@snippet :
/// DriverRegistry registry = DriverRegistryParser.parse(Path.of("rules.json"));
/// }
public final class DriverRegistryParser {

    private static final Logger logger = Logger.getLogger(DriverRegistryParser.class.getName());

    private DriverRegistryParser() {}

    /// Parses a rule-set document.
    ///
    /// @param json JSON string, not null
    /// @return validated registry, never null
    /// @throws ConfigurationException if the document is malformed or the rule set is invalid
    public static DriverRegistry parse(String json) {
        try {
            DriverRegistry registry = PrimeSerializer.createMapper().readValue(json, DriverRegistry.class);
            logger.fine(() -> "Loaded driver registry " + registry.getVersion());
            return registry;
        } catch (JsonProcessingException e) {
            ConfigurationException cause = findConfigurationCause(e);
            if (cause != null) {
                throw cause;
            }
            throw new ConfigurationException("Invalid driver registry: " + e.getOriginalMessage(), e);
        }
    }

    /// Reads and parses a rule-set file.
    ///
    /// @param path file to read, not null
    /// @return validated registry, never null
    /// @throws ConfigurationException if the file cannot be read or is invalid
    public static DriverRegistry parse(Path path) {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read driver registry " + path + ": " + e.getMessage(), e);
        }
        return parse(json);
    }

    /// Writes a registry as a rule-set document.
    ///
    /// @param registry the registry to write, not null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(DriverRegistry registry) {
        try {
            return PrimeSerializer.createMapper().writeValueAsString(registry);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize driver registry: " + e.getMessage(), e);
        }
    }

    // Builder validation inside Jackson gets wrapped; surface the original message.
    private static ConfigurationException findConfigurationCause(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ConfigurationException configurationError) {
                return configurationError;
            }
        }
        return null;
    }
}
