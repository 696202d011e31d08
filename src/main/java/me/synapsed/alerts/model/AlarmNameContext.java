package me.synapsed.alerts.model;

import lombok.Builder;
import lombok.Value;

/**
 * Variables available to alarm name templates.
 */
@Value
@Builder
public class AlarmNameContext {
    String template;
    String prefixTemplate;
    String functionName;
    String functionLogicalId;
    String metricName;
    String metricId;
    String stackName;
}
