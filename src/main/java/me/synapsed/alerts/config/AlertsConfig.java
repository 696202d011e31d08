package me.synapsed.alerts.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The alerting section of a deployment descriptor ({@code custom.alerts}).
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertsConfig {
    private List<String> stages;
    private Map<String, ObjectNode> definitions = new LinkedHashMap<>();
    private List<AlarmReference> alarms = new ArrayList<>();
    private List<AlarmReference> global = new ArrayList<>();
    private List<AlarmReference> function = new ArrayList<>();
    private TopicsConfig topics;
    private String nameTemplate;
    private String prefixTemplate;
    /** Boolean, template name, list of template names, or {stages, templates}. */
    private JsonNode dashboards;

    /**
     * Union of the {@code alarms}, {@code global} and {@code function} lists, first occurrence wins.
     */
    public List<AlarmReference> globalAlarmReferences() {
        Set<AlarmReference> union = new LinkedHashSet<>();
        addAll(union, alarms);
        addAll(union, global);
        addAll(union, function);
        return new ArrayList<>(union);
    }

    public boolean isDeployedOnStage(String stage) {
        return stages == null || stages.contains(stage);
    }

    public boolean hasDashboards() {
        return dashboards != null && !dashboards.isNull()
            && !(dashboards.isBoolean() && !dashboards.asBoolean())
            && !(dashboards.isTextual() && dashboards.asText().isEmpty());
    }

    private static void addAll(Set<AlarmReference> union, List<AlarmReference> references) {
        if (references == null) {
            return;
        }
        for (AlarmReference reference : references) {
            if (reference != null) {
                union.add(reference);
            }
        }
    }
}
