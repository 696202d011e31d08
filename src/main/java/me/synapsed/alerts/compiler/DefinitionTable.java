package me.synapsed.alerts.compiler;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.node.ObjectNode;

import me.synapsed.alerts.model.AlarmSpec;

/**
 * Alarm definitions by name, built-ins already overridden by user entries.
 */
public class DefinitionTable {
    private final Map<String, ObjectNode> definitions;

    DefinitionTable(Map<String, ObjectNode> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /**
     * @return a copy of the raw definition, safe to merge into
     */
    public Optional<ObjectNode> find(String name) {
        return Optional.ofNullable(definitions.get(name)).map(ObjectNode::deepCopy);
    }

    public Set<String> names() {
        return definitions.keySet();
    }

    /**
     * Typed view of a definition as declared, named after its key.
     */
    public AlarmSpec spec(String name) {
        ObjectNode definition = find(name).orElseThrow(() -> new IllegalArgumentException("No definition " + name));
        definition.put("name", name);
        return DefinitionResolver.toSpec(definition, name);
    }
}
