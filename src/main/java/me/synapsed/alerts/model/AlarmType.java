package me.synapsed.alerts.model;

import java.util.Optional;

import lombok.Getter;

@Getter
public enum AlarmType {
    STATIC("static"),
    ANOMALY_DETECTION("anomalyDetection"),
    SUCCESS_RATE("successRate"),
    COMPOSITE("composite");

    private final String value;

    AlarmType(String value) {
        this.value = value;
    }

    public static Optional<AlarmType> fromValue(String value) {
        for (AlarmType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
