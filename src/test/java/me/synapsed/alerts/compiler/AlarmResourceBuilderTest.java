package me.synapsed.alerts.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import me.synapsed.alerts.config.ConfigLoader;
import me.synapsed.alerts.deployment.DeploymentNaming;
import me.synapsed.alerts.document.TemplateResourceDocument;
import me.synapsed.alerts.errors.InvalidTopicReferenceException;
import me.synapsed.alerts.errors.UnsupportedAlarmTypeException;
import me.synapsed.alerts.model.AlarmSpec;
import me.synapsed.alerts.model.FunctionContext;
import me.synapsed.alerts.model.Resource;
import me.synapsed.alerts.model.ResourceTypes;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class AlarmResourceBuilderTest {

    @Mock
    private DeploymentNaming naming;

    private AlarmResourceBuilder builder;
    private ActionTopicTable noTopics;
    private FunctionContext function;

    @BeforeEach
    void setUp() {
        when(naming.stackName()).thenReturn("svc-dev");
        when(naming.functionReference(any(FunctionContext.class))).thenReturn(Map.of("Ref", "FooLambdaFunction"));
        when(naming.logGroupDependencies(any(FunctionContext.class))).thenReturn(List.of("FooLogGroup"));
        builder = new AlarmResourceBuilder(naming);
        noTopics = new ActionTopicTable();
        function = FunctionContext.builder()
            .name("foo")
            .deployedName("svc-dev-foo")
            .logicalId("FooLambdaFunction")
            .logGroupLogicalId("FooLogGroup")
            .logGroupName("/aws/lambda/svc-dev-foo")
            .build();
    }

    @Test
    public void testStaticAlarm() {
        Resource alarm = builder.buildAlarm(noTopics, highErrors().build(), function).get();
        Map<String, Object> properties = alarm.getProperties();

        assertEquals(ResourceTypes.ALARM, alarm.getType());
        assertEquals("Errors", properties.get("MetricName"));
        assertEquals(5, properties.get("Threshold"));
        assertEquals("Sum", properties.get("Statistic"));
        assertEquals(60, properties.get("Period"));
        assertEquals(1, properties.get("EvaluationPeriods"));
        assertEquals("GreaterThanThreshold", properties.get("ComparisonOperator"));
        assertEquals("missing", properties.get("TreatMissingData"));
        assertEquals(List.of(), properties.get("OKActions"));
        assertEquals(List.of(), properties.get("AlarmActions"));
        assertEquals(List.of(), properties.get("InsufficientDataActions"));
        assertEquals(List.of(Map.of("Name", "FunctionName", "Value", Map.of("Ref", "FooLambdaFunction"))),
            properties.get("Dimensions"));
        assertFalse(properties.containsKey("ExtendedStatistic"));
        assertFalse(properties.containsKey("AlarmName"));
        assertFalse(properties.containsKey("Namespace"));
    }

    @Test
    public void testPercentileUsesExtendedStatistic() {
        AlarmSpec spec = highErrors()
            .statistic("p95")
            .evaluateLowSampleCountPercentile("ignore")
            .build();

        Map<String, Object> properties = builder.buildAlarm(noTopics, spec, function).get().getProperties();

        assertEquals("p95", properties.get("ExtendedStatistic"));
        assertEquals("ignore", properties.get("EvaluateLowSampleCountPercentile"));
        assertFalse(properties.containsKey("Statistic"));
    }

    @Test
    public void testDeclaredFunctionNameDimensionIsReplaced() {
        AlarmSpec spec = highErrors()
            .dimensions(List.of(
                Map.of("Name", "FunctionName", "Value", "other"),
                Map.of("Name", "Resource", "Value", "foo:live")))
            .build();

        Object dimensions = builder.buildAlarm(noTopics, spec, function).get().getProperties().get("Dimensions");

        assertEquals(List.of(
            Map.of("Name", "Resource", "Value", "foo:live"),
            Map.of("Name", "FunctionName", "Value", Map.of("Ref", "FooLambdaFunction"))), dimensions);
    }

    @Test
    public void testOmitDefaultDimension() {
        AlarmSpec spec = highErrors().omitDefaultDimension(true).build();

        Object dimensions = builder.buildAlarm(noTopics, spec, function).get().getProperties().get("Dimensions");

        assertEquals(List.of(), dimensions);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testAnomalyDetectionAlarm() {
        AlarmSpec spec = highErrors()
            .type("anomalyDetection")
            .threshold(2)
            .comparisonOperator("GreaterThanUpperThreshold")
            .build();

        Map<String, Object> properties = builder.buildAlarm(noTopics, spec, function).get().getProperties();

        assertEquals("ad1", properties.get("ThresholdMetricId"));
        assertFalse(properties.containsKey("Threshold"));
        assertFalse(properties.containsKey("MetricName"));

        List<Map<String, Object>> metrics = (List<Map<String, Object>>) properties.get("Metrics");
        assertEquals(2, metrics.size());
        assertEquals("m1", metrics.get(0).get("Id"));
        Map<String, Object> metricStat = (Map<String, Object>) metrics.get(0).get("MetricStat");
        assertEquals("Sum", metricStat.get("Stat"));
        assertEquals(60, metricStat.get("Period"));
        assertEquals("Errors", ((Map<String, Object>) metricStat.get("Metric")).get("MetricName"));
        assertEquals("ANOMALY_DETECTION_BAND(m1, 2)", metrics.get(1).get("Expression"));
        assertEquals("Errors (expected)", metrics.get(1).get("Label"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testSuccessRateAlarm() {
        AlarmSpec spec = highErrors()
            .type("successRate")
            .threshold(99)
            .comparisonOperator("LessThanThreshold")
            .build();

        Map<String, Object> properties = builder.buildAlarm(noTopics, spec, function).get().getProperties();

        assertEquals(99, properties.get("Threshold"));
        List<Map<String, Object>> metrics = (List<Map<String, Object>>) properties.get("Metrics");
        assertEquals(3, metrics.size());
        assertEquals(List.of("errors", "count", "successRate"),
            List.of(metrics.get(0).get("Id"), metrics.get(1).get("Id"), metrics.get(2).get("Id")));
        assertEquals(false, metrics.get(0).get("ReturnData"));
        assertEquals(false, metrics.get(1).get("ReturnData"));
        assertEquals(true, metrics.get(2).get("ReturnData"));
        assertEquals("( 1 - (errors / count) ) * 100", metrics.get(2).get("Expression"));

        Map<String, Object> errors = (Map<String, Object>) ((Map<String, Object>) metrics.get(0).get("MetricStat"))
            .get("Metric");
        assertEquals("AWS/Lambda", errors.get("Namespace"));
        assertEquals("Errors", errors.get("MetricName"));
    }

    @Test
    public void testCompositeAndUnknownTypesAreRejected() {
        assertThrows(UnsupportedAlarmTypeException.class,
            () -> builder.buildAlarm(noTopics, highErrors().type("composite").build(), function));

        UnsupportedAlarmTypeException exception = assertThrows(UnsupportedAlarmTypeException.class,
            () -> builder.buildAlarm(noTopics, highErrors().type("bogus").build(), function));
        assertEquals("highErrors", exception.getDefinitionName());
        assertEquals("foo", exception.getFunctionName());
    }

    @Test
    public void testMissingFunctionLogicalIdYieldsNoAlarm() {
        FunctionContext unresolved = FunctionContext.builder()
            .name("foo")
            .deployedName("svc-dev-foo")
            .build();

        assertFalse(builder.buildAlarm(noTopics, highErrors().build(), unresolved).isPresent());
    }

    @Test
    public void testActionsCombineDefaultAndGroupTargets() {
        ActionTopicTable topics = new TopicSynthesizer().compileAlertTopics(
            ConfigLoader.parseAlertsConfig(String.join("\n",
                "topics:",
                "  alarm: default-alarms",
                "  critical:",
                "    alarm: arn:aws:sns:us-east-1:123456789012:pager")).getTopics(),
            new TemplateResourceDocument());
        AlarmSpec spec = highErrors().alarmActions(List.of("critical")).build();

        Map<String, Object> properties = builder.buildAlarm(topics, spec, function).get().getProperties();

        assertEquals(List.of(Map.of("Ref", "AwsAlertsAlarm"), "arn:aws:sns:us-east-1:123456789012:pager"),
            properties.get("AlarmActions"));
        assertEquals(List.of(), properties.get("OKActions"));
    }

    @Test
    public void testUnknownActionGroup() {
        AlarmSpec spec = highErrors().okActions(List.of("critical")).build();

        assertThrows(InvalidTopicReferenceException.class, () -> builder.buildAlarm(noTopics, spec, function));
    }

    @Test
    public void testAlarmNameFromTemplates() {
        AlarmSpec named = highErrors().nameTemplate("$[functionName]-$[metricName]").build();
        AlarmSpec prefixed = highErrors().prefixTemplate("team").build();

        assertEquals("svc-dev-foo-Errors",
            builder.buildAlarm(noTopics, named, function).get().getProperties().get("AlarmName"));
        assertEquals("team-foo-highErrors",
            builder.buildAlarm(noTopics, prefixed, function).get().getProperties().get("AlarmName"));
    }

    @Test
    public void testPatternAlarmUsesStackNamespace() {
        AlarmSpec spec = badRequests();

        Map<String, Object> properties = builder.buildAlarm(noTopics, spec, function).get().getProperties();

        assertEquals("svc-dev", properties.get("Namespace"));
        assertEquals("BadRequestsFooLambdaFunction", properties.get("MetricName"));
        assertEquals(List.of(), properties.get("Dimensions"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testLogMetricFilters() {
        Map<String, Resource> filters = builder.buildLogMetricFilters(badRequests(), function);

        assertEquals(List.of("FooLambdaFunctionBadRequestsLogMetricFilterALERT",
            "FooLambdaFunctionBadRequestsLogMetricFilterOK"), List.copyOf(filters.keySet()));

        Resource alert = filters.get("FooLambdaFunctionBadRequestsLogMetricFilterALERT");
        assertEquals(ResourceTypes.METRIC_FILTER, alert.getType());
        assertEquals(List.of("FooLogGroup"), alert.getDependsOn());
        assertEquals("Bad Request", alert.getProperties().get("FilterPattern"));
        assertEquals("/aws/lambda/svc-dev-foo", alert.getProperties().get("LogGroupName"));
        Map<String, Object> transformation =
            ((List<Map<String, Object>>) alert.getProperties().get("MetricTransformations")).get(0);
        assertEquals(1, transformation.get("MetricValue"));
        assertEquals("svc-dev", transformation.get("MetricNamespace"));
        assertEquals("BadRequestsFooLambdaFunction", transformation.get("MetricName"));

        Resource ok = filters.get("FooLambdaFunctionBadRequestsLogMetricFilterOK");
        assertEquals("", ok.getProperties().get("FilterPattern"));
        assertEquals(0, ((List<Map<String, Object>>) ok.getProperties().get("MetricTransformations")).get(0)
            .get("MetricValue"));
    }

    @Test
    public void testNoFiltersWithoutPattern() {
        assertTrue(builder.buildLogMetricFilters(highErrors().build(), function).isEmpty());
    }

    private static AlarmSpec.AlarmSpecBuilder highErrors() {
        return AlarmSpec.builder()
            .name("highErrors")
            .type("static")
            .metric("Errors")
            .threshold(5)
            .statistic("Sum")
            .period(60)
            .evaluationPeriods(1)
            .comparisonOperator("GreaterThanThreshold");
    }

    private static AlarmSpec badRequests() {
        return AlarmSpec.builder()
            .name("badRequests")
            .type("static")
            .metric("badRequests")
            .pattern("Bad Request")
            .threshold(1)
            .statistic("Sum")
            .period(60)
            .evaluationPeriods(1)
            .comparisonOperator("GreaterThanOrEqualToThreshold")
            .build();
    }
}
