package me.synapsed.alerts.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;
import me.synapsed.alerts.config.AlarmReference;
import me.synapsed.alerts.errors.AlertsConfigurationException;
import me.synapsed.alerts.errors.UnknownDefinitionException;
import me.synapsed.alerts.model.AlarmSpec;
import me.synapsed.alerts.model.AlarmType;
import me.synapsed.alerts.utils.JsonMerge;

/**
 * Merges alarm definitions and resolves alarm references against them.
 */
@Slf4j
public class DefinitionResolver {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Deep-merges user definitions over the built-ins; user values win on every leaf.
     */
    public DefinitionTable mergeDefinitions(Map<String, ObjectNode> builtIns, Map<String, ObjectNode> userDefinitions) {
        Map<String, ObjectNode> merged = new LinkedHashMap<>();
        if (builtIns != null) {
            builtIns.forEach((name, definition) -> merged.put(name, JsonMerge.merge(newObject(), definition)));
        }
        if (userDefinitions != null) {
            userDefinitions.forEach((name, definition) ->
                JsonMerge.merge(merged.computeIfAbsent(name, key -> newObject()), definition));
        }
        log.debug("Merged {} alarm definitions", merged.size());
        return new DefinitionTable(merged);
    }

    /**
     * Resolves each reference in order. Duplicates are kept.
     */
    public List<AlarmSpec> resolveAlarms(List<AlarmReference> references, DefinitionTable definitions) {
        List<AlarmSpec> resolved = new ArrayList<>();
        if (references == null) {
            return resolved;
        }
        for (AlarmReference reference : references) {
            if (reference != null) {
                resolved.add(resolve(reference, definitions));
            }
        }
        return resolved;
    }

    public AlarmSpec resolve(AlarmReference reference, DefinitionTable definitions) {
        ObjectNode spec = defaults();
        if (reference.isNamed()) {
            ObjectNode definition = definitions.find(reference.getName())
                .orElseThrow(() -> new UnknownDefinitionException(reference.getName()));
            JsonMerge.merge(spec, definition);
            spec.put("name", reference.getName());
        } else {
            if (reference.getName() == null) {
                throw new AlertsConfigurationException("Inline alarm " + reference.getFields() + " must have a name");
            }
            // An inline alarm may extend a definition of the same name or stand on its own
            definitions.find(reference.getName()).ifPresent(definition -> JsonMerge.merge(spec, definition));
            JsonMerge.merge(spec, reference.getFields());
        }
        return toSpec(spec, reference.getName());
    }

    static AlarmSpec toSpec(ObjectNode node, String name) {
        try {
            return MAPPER.treeToValue(node, AlarmSpec.class);
        } catch (JsonProcessingException e) {
            throw new AlertsConfigurationException("Invalid alarm definition " + name + ": " + e.getOriginalMessage(), e);
        }
    }

    private static ObjectNode defaults() {
        ObjectNode defaults = newObject();
        defaults.put("enabled", true);
        defaults.put("type", AlarmType.STATIC.getValue());
        return defaults;
    }

    private static ObjectNode newObject() {
        return JsonNodeFactory.instance.objectNode();
    }
}
