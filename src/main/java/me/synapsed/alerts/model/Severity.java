package me.synapsed.alerts.model;

import java.util.Optional;

import lombok.Getter;

/**
 * Alarm state transitions that can carry notification actions.
 */
@Getter
public enum Severity {
    OK("ok"),
    ALARM("alarm"),
    INSUFFICIENT_DATA("insufficientData");

    private final String key;

    Severity(String key) {
        this.key = key;
    }

    public static Optional<Severity> fromKey(String key) {
        for (Severity severity : values()) {
            if (severity.key.equals(key)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
