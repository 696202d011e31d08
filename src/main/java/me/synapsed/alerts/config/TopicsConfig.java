package me.synapsed.alerts.config;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import lombok.AllArgsConstructor;
import lombok.Getter;
import me.synapsed.alerts.model.Severity;

/**
 * The {@code topics} section, flattened to (group, severity, topic) entries in declaration order.
 * Entries declared directly under {@code topics} have no group.
 */
@Getter
@AllArgsConstructor
@JsonDeserialize(using = TopicsConfigDeserializer.class)
public class TopicsConfig {
    private final List<Entry> entries;

    @Getter
    @AllArgsConstructor
    public static class Entry {
        /** Null for ungrouped entries. */
        private final String group;
        private final Severity severity;
        private final TopicConfig config;
    }
}
