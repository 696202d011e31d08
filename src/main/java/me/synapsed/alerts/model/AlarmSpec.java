package me.synapsed.alerts.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Fully merged alarm configuration, ready to be turned into resources.
 * Also used as the typed view of a raw alarm definition.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlarmSpec {
    String name;
    @Builder.Default
    boolean enabled = true;
    String type;
    String description;
    Boolean actionsEnabled;

    String namespace;
    String metric;
    String pattern;
    String statistic;
    Number threshold;
    Integer period;
    Integer evaluationPeriods;
    Integer datapointsToAlarm;
    String comparisonOperator;
    String treatMissingData;
    String evaluateLowSampleCountPercentile;

    @Builder.Default
    List<Map<String, Object>> dimensions = List.of();
    boolean omitDefaultDimension;

    String nameTemplate;
    String prefixTemplate;

    // Topic group names whose targets are appended to the default actions
    @Builder.Default
    List<String> okActions = List.of();
    @Builder.Default
    List<String> alarmActions = List.of();
    @Builder.Default
    List<String> insufficientDataActions = List.of();

    // Composite alarms only
    @Builder.Default
    List<String> alarmsToInclude = List.of();
    @Builder.Default
    List<String> alarmsActions = List.of();

    public Optional<AlarmType> alarmType() {
        return type == null ? Optional.empty() : AlarmType.fromValue(type);
    }

    public boolean hasPattern() {
        return pattern != null;
    }

    public List<String> actionGroups(Severity severity) {
        switch (severity) {
            case OK:
                return okActions;
            case ALARM:
                return alarmActions;
            case INSUFFICIENT_DATA:
            default:
                return insufficientDataActions;
        }
    }

    /**
     * Fills in naming templates the alarm does not declare itself.
     */
    public AlarmSpec withDefaultTemplates(String defaultNameTemplate, String defaultPrefixTemplate) {
        return toBuilder()
            .nameTemplate(nameTemplate != null ? nameTemplate : defaultNameTemplate)
            .prefixTemplate(prefixTemplate != null ? prefixTemplate : defaultPrefixTemplate)
            .build();
    }
}
