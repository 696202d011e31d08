package me.synapsed.alerts.utils;

import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Deep merge of Jackson object trees. Objects merge key by key, anything else
 * (scalars and arrays) is replaced by the later source. Null leaves never overwrite.
 */
public final class JsonMerge {

    private JsonMerge() {
    }

    /**
     * Merges each source into {@code target} in order and returns the target.
     */
    public static ObjectNode merge(ObjectNode target, JsonNode... sources) {
        for (JsonNode source : sources) {
            if (source != null && source.isObject()) {
                mergeObject(target, (ObjectNode) source);
            }
        }
        return target;
    }

    private static void mergeObject(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull() || value.isMissingNode()) {
                continue;
            }
            JsonNode existing = target.get(field.getKey());
            if (value.isObject() && existing != null && existing.isObject()) {
                mergeObject((ObjectNode) existing, (ObjectNode) value);
            } else {
                target.set(field.getKey(), value.deepCopy());
            }
        }
    }
}
