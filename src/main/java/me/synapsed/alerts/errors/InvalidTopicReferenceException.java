package me.synapsed.alerts.errors;

import lombok.Getter;

/**
 * Thrown when an alarm's action override names a topic group, or a severity within a group,
 * that the topics configuration does not define.
 */
@Getter
public class InvalidTopicReferenceException extends AlertsConfigurationException {
    private final String alarmName;
    private final String group;
    private final String severity;

    public InvalidTopicReferenceException(String alarmName, String group, String severity) {
        super(String.format("Alarm %s references topic group '%s' with no '%s' topic configured",
            alarmName, group, severity));
        this.alarmName = alarmName;
        this.group = group;
        this.severity = severity;
    }
}
