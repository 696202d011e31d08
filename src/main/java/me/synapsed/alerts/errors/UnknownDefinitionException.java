package me.synapsed.alerts.errors;

import lombok.Getter;

@Getter
public class UnknownDefinitionException extends AlertsConfigurationException {
    private final String definitionName;

    public UnknownDefinitionException(String definitionName) {
        super("Alarm definition " + definitionName + " does not exist!");
        this.definitionName = definitionName;
    }
}
