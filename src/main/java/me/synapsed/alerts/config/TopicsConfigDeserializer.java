package me.synapsed.alerts.config;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import me.synapsed.alerts.model.Severity;

public class TopicsConfigDeserializer extends StdDeserializer<TopicsConfig> {

    public TopicsConfigDeserializer() {
        super(TopicsConfig.class);
    }

    @Override
    public TopicsConfig deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        ObjectCodec codec = parser.getCodec();
        JsonNode root = codec.readTree(parser);
        if (!root.isObject()) {
            throw JsonMappingException.from(parser, "topics must be an object, got " + root.getNodeType());
        }

        List<TopicsConfig.Entry> entries = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (Severity.fromKey(field.getKey()).isPresent()) {
                addEntry(parser, codec, entries, null, field.getKey(), field.getValue());
            } else if (field.getValue().isObject()) {
                // Any other key names a group of per-severity topics
                String group = field.getKey();
                Iterator<Map.Entry<String, JsonNode>> groupFields = field.getValue().fields();
                while (groupFields.hasNext()) {
                    Map.Entry<String, JsonNode> groupField = groupFields.next();
                    addEntry(parser, codec, entries, group, groupField.getKey(), groupField.getValue());
                }
            } else if (!field.getValue().isNull()) {
                throw JsonMappingException.from(parser,
                    "Topic group " + field.getKey() + " must map severities to topics");
            }
        }
        return new TopicsConfig(entries);
    }

    private void addEntry(JsonParser parser, ObjectCodec codec, List<TopicsConfig.Entry> entries,
                          String group, String severityKey, JsonNode value) throws IOException {
        Severity severity = Severity.fromKey(severityKey)
            .orElseThrow(() -> JsonMappingException.from(parser,
                "Unknown severity '" + severityKey + "' in topic group " + group));
        if (value == null || value.isNull()) {
            return;
        }

        TopicConfig config;
        if (value.isObject()) {
            JsonNode notifications = value.get("notifications");
            List<Notification> subscriptions = notifications == null || notifications.isNull()
                ? List.of()
                : Arrays.asList(codec.treeToValue(notifications, Notification[].class));
            config = TopicConfig.detailed(value.get("topic"), subscriptions);
        } else {
            config = TopicConfig.literal(value.asText());
        }
        entries.add(new TopicsConfig.Entry(group, severity, config));
    }
}
