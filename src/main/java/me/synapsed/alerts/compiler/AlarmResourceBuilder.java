package me.synapsed.alerts.compiler;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;
import me.synapsed.alerts.deployment.DeploymentNaming;
import me.synapsed.alerts.errors.UnsupportedAlarmTypeException;
import me.synapsed.alerts.model.AlarmNameContext;
import me.synapsed.alerts.model.AlarmSpec;
import me.synapsed.alerts.model.AlarmType;
import me.synapsed.alerts.model.FunctionContext;
import me.synapsed.alerts.model.Resource;
import me.synapsed.alerts.model.ResourceTypes;
import me.synapsed.alerts.model.Severity;
import me.synapsed.alerts.utils.NamingUtils;

/**
 * Turns a resolved alarm into CloudWatch alarm and log metric filter resources for one function.
 */
@Slf4j
public class AlarmResourceBuilder {
    static final String LAMBDA_NAMESPACE = "AWS/Lambda";
    static final String DEFAULT_TREAT_MISSING_DATA = "missing";
    static final String ANOMALY_BAND_METRIC_ID = "ad1";

    private static final Set<String> STANDARD_STATISTICS = Set.of(
        "SampleCount", "Average", "Sum", "Minimum", "Maximum");

    private final DeploymentNaming naming;

    public AlarmResourceBuilder(DeploymentNaming naming) {
        this.naming = naming;
    }

    /**
     * Builds the alarm resource, or nothing if the function has no logical id.
     *
     * @throws UnsupportedAlarmTypeException if the alarm type is not static, anomalyDetection or successRate
     * @throws me.synapsed.alerts.errors.InvalidTopicReferenceException if an action override names an unknown topic
     */
    public Optional<Resource> buildAlarm(ActionTopicTable topics, AlarmSpec spec, FunctionContext function) {
        String functionRef = function.getLogicalId();
        if (functionRef == null) {
            return Optional.empty();
        }

        Map<Severity, List<Object>> actions = actions(topics, spec);

        String stackName = naming.stackName();
        String namespace = spec.hasPattern() ? stackName : spec.getNamespace();
        String metricId = spec.hasPattern()
            ? NamingUtils.patternMetricName(spec.getMetric(), functionRef)
            : spec.getMetric();
        List<Map<String, Object>> dimensions = spec.hasPattern()
            ? List.of()
            : dimensions(spec, function);
        String treatMissingData = spec.getTreatMissingData() != null
            ? spec.getTreatMissingData()
            : DEFAULT_TREAT_MISSING_DATA;

        AlarmType type = spec.alarmType()
            .filter(alarmType -> alarmType != AlarmType.COMPOSITE)
            .orElseThrow(() -> new UnsupportedAlarmTypeException(spec.getName(), function.getName(), spec.getType()));

        Map<String, Object> properties;
        switch (type) {
            case STATIC:
                properties = staticAlarm(spec, namespace, metricId, dimensions, treatMissingData, actions);
                break;
            case ANOMALY_DETECTION:
                properties = anomalyDetectionAlarm(spec, namespace, metricId, dimensions, treatMissingData, actions);
                break;
            case SUCCESS_RATE:
                properties = successRateAlarm(spec, namespace, dimensions, treatMissingData, actions);
                break;
            default:
                throw new UnsupportedAlarmTypeException(spec.getName(), function.getName(), spec.getType());
        }

        alarmName(spec, function, metricId, stackName)
            .ifPresent(alarmName -> properties.put("AlarmName", alarmName));

        return Optional.of(Resource.builder()
            .type(ResourceTypes.ALARM)
            .properties(properties)
            .build());
    }

    /**
     * Builds the ALERT and OK metric filters feeding a pattern-based alarm. The OK filter matches
     * every log event with value 0 so the metric has data whenever the function logs.
     */
    public Map<String, Resource> buildLogMetricFilters(AlarmSpec spec, FunctionContext function) {
        Map<String, Resource> filters = new LinkedHashMap<>();
        if (!spec.hasPattern()) {
            return filters;
        }

        String logicalIdBase = NamingUtils.logMetricFilterLogicalId(function.getLogicalId(), spec.getName());
        String metricNamespace = naming.stackName();
        String metricName = NamingUtils.patternMetricName(spec.getMetric(), function.getLogicalId());

        filters.put(logicalIdBase + "ALERT",
            metricFilter(spec.getPattern(), 1, function, metricNamespace, metricName));
        filters.put(logicalIdBase + "OK",
            metricFilter("", 0, function, metricNamespace, metricName));
        return filters;
    }

    private Resource metricFilter(String pattern, int value, FunctionContext function,
                                  String metricNamespace, String metricName) {
        Map<String, Object> transformation = new LinkedHashMap<>();
        transformation.put("MetricValue", value);
        transformation.put("MetricNamespace", metricNamespace);
        transformation.put("MetricName", metricName);

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("FilterPattern", pattern);
        properties.put("LogGroupName", function.getLogGroupName());
        properties.put("MetricTransformations", List.of(transformation));

        return Resource.builder()
            .type(ResourceTypes.METRIC_FILTER)
            .dependsOn(naming.logGroupDependencies(function))
            .properties(properties)
            .build();
    }

    private Map<String, Object> staticAlarm(AlarmSpec spec, String namespace, String metricId,
                                            List<Map<String, Object>> dimensions, String treatMissingData,
                                            Map<Severity, List<Object>> actions) {
        Map<String, Object> properties = new LinkedHashMap<>();
        put(properties, "ActionsEnabled", spec.getActionsEnabled());
        put(properties, "Namespace", namespace);
        put(properties, "MetricName", metricId);
        put(properties, "AlarmDescription", spec.getDescription());
        put(properties, "Threshold", spec.getThreshold());
        put(properties, "Period", spec.getPeriod());
        put(properties, "EvaluationPeriods", spec.getEvaluationPeriods());
        put(properties, "DatapointsToAlarm", spec.getDatapointsToAlarm());
        put(properties, "ComparisonOperator", spec.getComparisonOperator());
        properties.put("OKActions", actions.get(Severity.OK));
        properties.put("AlarmActions", actions.get(Severity.ALARM));
        properties.put("InsufficientDataActions", actions.get(Severity.INSUFFICIENT_DATA));
        properties.put("Dimensions", dimensions);
        properties.put("TreatMissingData", treatMissingData);

        if (STANDARD_STATISTICS.contains(spec.getStatistic())) {
            properties.put("Statistic", spec.getStatistic());
        } else {
            // Percentiles such as p95
            put(properties, "ExtendedStatistic", spec.getStatistic());
            put(properties, "EvaluateLowSampleCountPercentile", spec.getEvaluateLowSampleCountPercentile());
        }
        return properties;
    }

    private Map<String, Object> anomalyDetectionAlarm(AlarmSpec spec, String namespace, String metricId,
                                                      List<Map<String, Object>> dimensions, String treatMissingData,
                                                      Map<Severity, List<Object>> actions) {
        Map<String, Object> properties = metricMathAlarm(spec, treatMissingData, actions);

        Map<String, Object> rawMetric = new LinkedHashMap<>();
        rawMetric.put("Id", "m1");
        rawMetric.put("ReturnData", true);
        rawMetric.put("MetricStat", metricStat(namespace, metricId, dimensions, spec.getPeriod(), spec.getStatistic()));

        Map<String, Object> band = new LinkedHashMap<>();
        band.put("Id", ANOMALY_BAND_METRIC_ID);
        band.put("Expression", "ANOMALY_DETECTION_BAND(m1, " + spec.getThreshold() + ")");
        band.put("Label", metricId + " (expected)");
        band.put("ReturnData", true);

        properties.put("Metrics", List.of(rawMetric, band));
        properties.put("ThresholdMetricId", ANOMALY_BAND_METRIC_ID);
        return properties;
    }

    private Map<String, Object> successRateAlarm(AlarmSpec spec, String namespace,
                                                 List<Map<String, Object>> dimensions, String treatMissingData,
                                                 Map<Severity, List<Object>> actions) {
        Map<String, Object> properties = metricMathAlarm(spec, treatMissingData, actions);
        String metricNamespace = namespace != null ? namespace : LAMBDA_NAMESPACE;

        Map<String, Object> errors = new LinkedHashMap<>();
        errors.put("Id", "errors");
        errors.put("ReturnData", false);
        errors.put("MetricStat", metricStat(metricNamespace, "Errors", dimensions, spec.getPeriod(), "Sum"));

        Map<String, Object> count = new LinkedHashMap<>();
        count.put("Id", "count");
        count.put("ReturnData", false);
        count.put("MetricStat", metricStat(metricNamespace, "Invocations", dimensions, spec.getPeriod(), "Sum"));

        Map<String, Object> successRate = new LinkedHashMap<>();
        successRate.put("Id", "successRate");
        successRate.put("Expression", "( 1 - (errors / count) ) * 100");
        successRate.put("ReturnData", true);

        properties.put("Metrics", List.of(errors, count, successRate));
        put(properties, "Threshold", spec.getThreshold());
        return properties;
    }

    private Map<String, Object> metricMathAlarm(AlarmSpec spec, String treatMissingData,
                                                Map<Severity, List<Object>> actions) {
        Map<String, Object> properties = new LinkedHashMap<>();
        put(properties, "ActionsEnabled", spec.getActionsEnabled());
        put(properties, "AlarmDescription", spec.getDescription());
        put(properties, "EvaluationPeriods", spec.getEvaluationPeriods());
        put(properties, "DatapointsToAlarm", spec.getDatapointsToAlarm());
        put(properties, "ComparisonOperator", spec.getComparisonOperator());
        properties.put("TreatMissingData", treatMissingData);
        properties.put("OKActions", actions.get(Severity.OK));
        properties.put("AlarmActions", actions.get(Severity.ALARM));
        properties.put("InsufficientDataActions", actions.get(Severity.INSUFFICIENT_DATA));
        return properties;
    }

    private Map<String, Object> metricStat(String namespace, String metricName,
                                           List<Map<String, Object>> dimensions, Integer period, String stat) {
        Map<String, Object> metric = new LinkedHashMap<>();
        put(metric, "Namespace", namespace);
        put(metric, "MetricName", metricName);
        metric.put("Dimensions", dimensions);

        Map<String, Object> metricStat = new LinkedHashMap<>();
        metricStat.put("Metric", metric);
        put(metricStat, "Period", period);
        put(metricStat, "Stat", stat);
        return metricStat;
    }

    /**
     * Default targets first, then the targets of every group the alarm names for that severity.
     */
    private Map<Severity, List<Object>> actions(ActionTopicTable topics, AlarmSpec spec) {
        Map<Severity, List<Object>> actions = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            List<Object> targets = new ArrayList<>();
            topics.defaultTarget(severity).ifPresent(targets::add);
            for (String group : spec.actionGroups(severity)) {
                targets.add(topics.groupTarget(group, severity, spec.getName()));
            }
            actions.put(severity, targets);
        }
        return actions;
    }

    private List<Map<String, Object>> dimensions(AlarmSpec spec, FunctionContext function) {
        List<Map<String, Object>> declared = spec.getDimensions() == null ? List.of() : spec.getDimensions();
        if (spec.isOmitDefaultDimension()) {
            return new ArrayList<>(declared);
        }

        List<Map<String, Object>> dimensions = new ArrayList<>();
        for (Map<String, Object> dimension : declared) {
            if (!"FunctionName".equals(dimension.get("Name"))) {
                dimensions.add(dimension);
            }
        }
        Map<String, Object> functionDimension = new LinkedHashMap<>();
        functionDimension.put("Name", "FunctionName");
        functionDimension.put("Value", naming.functionReference(function));
        dimensions.add(functionDimension);
        return dimensions;
    }

    private Optional<String> alarmName(AlarmSpec spec, FunctionContext function, String metricId, String stackName) {
        AlarmNameContext.AlarmNameContextBuilder context = AlarmNameContext.builder()
            .prefixTemplate(spec.getPrefixTemplate())
            .functionName(function.getName())
            .functionLogicalId(function.getLogicalId())
            .metricId(metricId)
            .stackName(stackName);

        if (isSet(spec.getNameTemplate())) {
            return Optional.of(NamingUtils.alarmName(context
                .template(spec.getNameTemplate())
                .metricName(spec.getMetric())
                .build()));
        }
        if (isSet(spec.getPrefixTemplate())) {
            return Optional.of(NamingUtils.alarmName(context
                .template(NamingUtils.DEFAULT_ALARM_NAME_TEMPLATE)
                .metricName(spec.getName() != null ? spec.getName() : spec.getMetric())
                .build()));
        }
        // Left to CloudFormation to generate
        return Optional.empty();
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }

    private static void put(Map<String, Object> properties, String key, Object value) {
        if (value != null) {
            properties.put(key, value);
        }
    }
}
