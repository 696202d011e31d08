package me.synapsed.alerts.errors;

import lombok.Getter;

@Getter
public class UnsupportedAlarmTypeException extends AlertsConfigurationException {
    private final String definitionName;
    private final String functionName;

    public UnsupportedAlarmTypeException(String definitionName, String functionName, String type) {
        super(String.format("Unsupported type '%s' for alarm %s on function %s, must be one of 'static', 'anomalyDetection' or 'successRate'",
            type, definitionName, functionName));
        this.definitionName = definitionName;
        this.functionName = functionName;
    }
}
