package me.synapsed.alerts.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import me.synapsed.alerts.errors.AlertsConfigurationException;
import me.synapsed.alerts.model.Resource;

/**
 * In-memory {@code Resources} section of a CloudFormation template.
 */
public class TemplateResourceDocument implements ResourceDocument {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, Resource> resources = new LinkedHashMap<>();

    @Override
    public Optional<Resource> get(String logicalId) {
        return Optional.ofNullable(resources.get(logicalId));
    }

    @Override
    public void merge(Map<String, Resource> incoming) {
        incoming.forEach((logicalId, resource) ->
            resources.merge(logicalId, resource, TemplateResourceDocument::mergeResource));
    }

    @Override
    public void delete(String logicalId) {
        resources.remove(logicalId);
    }

    @Override
    public Map<String, Resource> resources() {
        return Collections.unmodifiableMap(resources);
    }

    public String toJson() {
        try {
            return JSON_MAPPER.writeValueAsString(Map.of("Resources", resources));
        } catch (JsonProcessingException e) {
            throw new AlertsConfigurationException("Failed to serialize resources", e);
        }
    }

    static Resource mergeResource(Resource existing, Resource incoming) {
        Map<String, Object> properties = new LinkedHashMap<>(existing.getProperties());
        mergeProperties(properties, incoming.getProperties());
        return existing.toBuilder()
            .type(incoming.getType() != null ? incoming.getType() : existing.getType())
            .dependsOn(incoming.getDependsOn().isEmpty() ? existing.getDependsOn() : incoming.getDependsOn())
            .properties(properties)
            .build();
    }

    @SuppressWarnings("unchecked")
    private static void mergeProperties(Map<String, Object> target, Map<String, Object> source) {
        source.forEach((key, value) -> {
            Object existing = target.get(key);
            if (value instanceof Map && existing instanceof Map) {
                Map<String, Object> nested = new LinkedHashMap<>((Map<String, Object>) existing);
                mergeProperties(nested, (Map<String, Object>) value);
                target.put(key, nested);
            } else if (value != null) {
                target.put(key, value);
            }
        });
    }
}
