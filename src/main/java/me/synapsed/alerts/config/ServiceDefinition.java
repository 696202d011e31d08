package me.synapsed.alerts.config;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import me.synapsed.alerts.deployment.FunctionDefinition;

/**
 * The parts of a serverless-style deployment descriptor the alerts compiler reads.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceDefinition {
    private String service;
    private Provider provider = new Provider();
    private Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
    private Custom custom = new Custom();

    public AlertsConfig alertsConfig() {
        return custom == null ? null : custom.getAlerts();
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Provider {
        private String stage = "dev";
        private String region = "us-east-1";
        /** Overrides the default {@code <service>-<stage>} stack name. */
        private String stackName;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Custom {
        private AlertsConfig alerts;
    }
}
