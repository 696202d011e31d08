package me.synapsed.alerts.config;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import lombok.Getter;

/**
 * Topic configuration for one severity. Written either as a plain string ({@code alarm: my-topic})
 * or as {@code {topic, notifications}}. The topic value is an ARN, an intrinsic function object,
 * or the name of a topic to create.
 */
@Getter
public final class TopicConfig {
    private static final String ARN_PREFIX = "arn:";

    private final JsonNode topic;
    private final List<Notification> notifications;

    private TopicConfig(JsonNode topic, List<Notification> notifications) {
        this.topic = topic;
        this.notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }

    public static TopicConfig literal(String topic) {
        return new TopicConfig(TextNode.valueOf(topic), List.of());
    }

    public static TopicConfig detailed(JsonNode topic, List<Notification> notifications) {
        return new TopicConfig(topic, notifications);
    }

    public boolean hasTopic() {
        return topic != null && !topic.isNull() && !(topic.isTextual() && topic.asText().isEmpty());
    }

    /**
     * Whether the topic already exists outside this deployment and is referenced as-is.
     */
    public boolean isExistingTopic() {
        return topic.isObject() || topic.asText().startsWith(ARN_PREFIX);
    }
}
