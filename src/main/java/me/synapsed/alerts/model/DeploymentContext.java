package me.synapsed.alerts.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeploymentContext {
    String service;
    String stage;
    String region;
}
