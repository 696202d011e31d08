package me.synapsed.alerts.errors;

/**
 * Base class for every error that aborts a compile pass.
 */
public class AlertsConfigurationException extends RuntimeException {

    public AlertsConfigurationException(String message) {
        super(message);
    }

    public AlertsConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
