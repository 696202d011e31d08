package me.synapsed.alerts.errors;

public class MissingConfigurationException extends AlertsConfigurationException {

    public MissingConfigurationException(String argumentName) {
        super("Missing " + argumentName + " argument");
    }
}
