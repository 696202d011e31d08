package me.synapsed.alerts.utils;

import me.synapsed.alerts.model.AlarmNameContext;
import me.synapsed.alerts.model.DeploymentContext;
import me.synapsed.alerts.model.Severity;

/**
 * Utility class for generating the deterministic logical ids and names of alerting resources.
 * Every id is a pure function of its inputs so repeated compiles produce the same document.
 */
public final class NamingUtils {
    public static final String DEFAULT_ALARM_NAME_TEMPLATE = "$[functionName]-$[metricName]";
    public static final String DEFAULT_PREFIX_TEMPLATE = "$[stackName]";
    public static final String DEFAULT_DASHBOARD_TEMPLATE = "default";

    private NamingUtils() {
    }

    public static String upperFirst(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    /**
     * Normalizes a name into a CloudFormation-safe identifier fragment.
     */
    public static String normalizedName(String name) {
        return upperFirst(name.replace("-", "Dash").replace("_", "Underscore"));
    }

    public static String alarmLogicalId(String alarmName, String functionName) {
        return normalizedName(functionName) + normalizedName(alarmName) + "Alarm";
    }

    public static String logMetricFilterLogicalId(String functionLogicalId, String alarmName) {
        return functionLogicalId + upperFirst(alarmName) + "LogMetricFilter";
    }

    /**
     * Name of the custom metric a pattern-based alarm watches.
     */
    public static String patternMetricName(String metricName, String functionLogicalId) {
        return upperFirst(metricName) + functionLogicalId;
    }

    /**
     * @param group topic group name, or null for ungrouped topics
     */
    public static String topicLogicalId(String group, Severity severity) {
        return "AwsAlerts" + (group != null ? upperFirst(group) : "") + upperFirst(severity.getKey());
    }

    public static String compositeAlarmLogicalId(String definitionName) {
        return "AlertsComposite" + upperFirst(definitionName);
    }

    public static String compositeAlarmName(DeploymentContext deployment, String definitionName) {
        return String.format("%s-%s-%s-%s", deployment.getService(), deployment.getStage(),
            deployment.getRegion(), upperFirst(definitionName));
    }

    public static String dashboardLogicalId(String template) {
        return DEFAULT_DASHBOARD_TEMPLATE.equals(template) ? "AlertsDashboard" : "AlertsDashboard" + template;
    }

    public static String dashboardName(DeploymentContext deployment, String template) {
        String base = String.format("%s-%s-%s", deployment.getService(), deployment.getStage(), deployment.getRegion());
        return DEFAULT_DASHBOARD_TEMPLATE.equals(template) ? base : base + "-" + template;
    }

    /**
     * Renders an alarm name template. The prefix defaults to the stack name; an empty prefix
     * leaves the rendered template unprefixed.
     */
    public static String alarmName(AlarmNameContext context) {
        String name = context.getTemplate()
            .replace("$[functionName]", String.valueOf(context.getFunctionName()))
            .replace("$[functionId]", String.valueOf(context.getFunctionLogicalId()))
            .replace("$[metricName]", String.valueOf(context.getMetricName()))
            .replace("$[metricId]", String.valueOf(context.getMetricId()));

        String prefixTemplate = context.getPrefixTemplate() != null
            ? context.getPrefixTemplate()
            : DEFAULT_PREFIX_TEMPLATE;
        String prefix = prefixTemplate.replace("$[stackName]", String.valueOf(context.getStackName()));

        return prefix.isEmpty() ? name : prefix + "-" + name;
    }
}
