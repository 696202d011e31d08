package me.synapsed.alerts.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import lombok.extern.slf4j.Slf4j;
import me.synapsed.alerts.errors.AlertsConfigurationException;

/**
 * Reads deployment descriptors and the built-in alarm definitions from YAML.
 */
@Slf4j
public final class ConfigLoader {
    static final String BUILT_IN_DEFINITIONS = "/alerts/default-definitions.yml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ConfigLoader() {
    }

    public static ServiceDefinition loadServiceDefinition(Path path) {
        log.info("Loading deployment descriptor from {}", path);
        try (InputStream input = Files.newInputStream(path)) {
            return YAML_MAPPER.readValue(input, ServiceDefinition.class);
        } catch (IOException e) {
            throw new AlertsConfigurationException("Failed to read deployment descriptor " + path, e);
        }
    }

    public static ServiceDefinition loadServiceDefinition(InputStream input) {
        try {
            return YAML_MAPPER.readValue(input, ServiceDefinition.class);
        } catch (IOException e) {
            throw new AlertsConfigurationException("Failed to parse deployment descriptor", e);
        }
    }

    public static AlertsConfig parseAlertsConfig(String yaml) {
        try {
            return YAML_MAPPER.readValue(yaml, AlertsConfig.class);
        } catch (IOException e) {
            throw new AlertsConfigurationException("Failed to parse alerts configuration", e);
        }
    }

    /**
     * Loads the definitions every deployment starts from; user definitions are merged over these.
     */
    public static Map<String, ObjectNode> loadBuiltInDefinitions() {
        try (InputStream input = ConfigLoader.class.getResourceAsStream(BUILT_IN_DEFINITIONS)) {
            if (input == null) {
                throw new AlertsConfigurationException("Missing built-in definitions " + BUILT_IN_DEFINITIONS);
            }
            Map<String, ObjectNode> definitions = YAML_MAPPER.readValue(input,
                new TypeReference<LinkedHashMap<String, ObjectNode>>() {});
            return definitions == null ? new LinkedHashMap<>() : definitions;
        } catch (IOException e) {
            throw new AlertsConfigurationException("Failed to read built-in definitions", e);
        }
    }
}
