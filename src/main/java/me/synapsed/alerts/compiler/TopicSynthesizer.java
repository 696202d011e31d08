package me.synapsed.alerts.compiler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import me.synapsed.alerts.config.Notification;
import me.synapsed.alerts.config.TopicConfig;
import me.synapsed.alerts.config.TopicsConfig;
import me.synapsed.alerts.document.ResourceDocument;
import me.synapsed.alerts.model.Resource;
import me.synapsed.alerts.model.ResourceTypes;
import me.synapsed.alerts.utils.Intrinsics;
import me.synapsed.alerts.utils.NamingUtils;

/**
 * Builds the action-topic table. Existing topics are referenced as configured; topics given
 * by name are created as SNS topic resources and referenced by logical id.
 */
@Slf4j
public class TopicSynthesizer {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ActionTopicTable compileAlertTopics(TopicsConfig topics, ResourceDocument document) {
        ActionTopicTable table = new ActionTopicTable();
        if (topics == null) {
            return table;
        }

        for (TopicsConfig.Entry entry : topics.getEntries()) {
            TopicConfig config = entry.getConfig();
            if (!config.hasTopic()) {
                continue;
            }

            if (config.isExistingTopic()) {
                table.put(entry.getGroup(), entry.getSeverity(), existingTarget(config.getTopic()));
            } else {
                String logicalId = NamingUtils.topicLogicalId(entry.getGroup(), entry.getSeverity());
                table.put(entry.getGroup(), entry.getSeverity(), Intrinsics.ref(logicalId));

                Map<String, Resource> resources = new LinkedHashMap<>();
                resources.put(logicalId, topicResource(config.getTopic().asText(), config.getNotifications()));
                document.merge(resources);
                log.debug("Created topic {} for {} notifications", logicalId, entry.getSeverity().getKey());
            }
        }
        return table;
    }

    Resource topicResource(String topicName, List<Notification> notifications) {
        List<Map<String, Object>> subscription = notifications.stream()
            .map(notification -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("Protocol", notification.getProtocol());
                entry.put("Endpoint", notification.getEndpoint());
                return entry;
            })
            .collect(Collectors.toList());

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("TopicName", topicName);
        properties.put("Subscription", subscription);

        return Resource.builder()
            .type(ResourceTypes.TOPIC)
            .properties(properties)
            .build();
    }

    private static Object existingTarget(JsonNode topic) {
        if (topic.isObject()) {
            return MAPPER.convertValue(topic, new TypeReference<LinkedHashMap<String, Object>>() {});
        }
        return topic.asText();
    }
}
