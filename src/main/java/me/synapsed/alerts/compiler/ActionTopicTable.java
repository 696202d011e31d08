package me.synapsed.alerts.compiler;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import me.synapsed.alerts.errors.InvalidTopicReferenceException;
import me.synapsed.alerts.model.Severity;

/**
 * Notification targets by severity, plus named groups of per-severity targets.
 * A target is an ARN string or an intrinsic function map such as {@code {Ref: AwsAlertsAlarm}}.
 */
public class ActionTopicTable {
    private final Map<Severity, Object> defaults = new EnumMap<>(Severity.class);
    private final Map<String, Map<Severity, Object>> groups = new LinkedHashMap<>();

    void put(String group, Severity severity, Object target) {
        if (group == null) {
            defaults.put(severity, target);
        } else {
            groups.computeIfAbsent(group, key -> new EnumMap<>(Severity.class)).put(severity, target);
        }
    }

    public Optional<Object> defaultTarget(Severity severity) {
        return Optional.ofNullable(defaults.get(severity));
    }

    /**
     * Looks up the target a group configures for a severity.
     *
     * @throws InvalidTopicReferenceException if the group or the severity within it is not configured
     */
    public Object groupTarget(String group, Severity severity, String alarmName) {
        Map<Severity, Object> targets = groups.get(group);
        if (targets == null || !targets.containsKey(severity)) {
            throw new InvalidTopicReferenceException(alarmName, group, severity.getKey());
        }
        return targets.get(severity);
    }

    public boolean isEmpty() {
        return defaults.isEmpty() && groups.isEmpty();
    }
}
