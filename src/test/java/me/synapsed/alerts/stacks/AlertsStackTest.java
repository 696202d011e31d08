package me.synapsed.alerts.stacks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import me.synapsed.alerts.config.ConfigLoader;
import me.synapsed.alerts.config.ServiceDefinition;
import me.synapsed.alerts.model.DeploymentContext;
import software.amazon.awscdk.App;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.assertions.Match;
import software.amazon.awscdk.assertions.Template;

public class AlertsStackTest {
    private ServiceDefinition serviceDefinition;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream input = getClass().getResourceAsStream("/serverless.yml")) {
            serviceDefinition = ConfigLoader.loadServiceDefinition(input);
        }
    }

    @Test
    public void testAlertsStack() {
        // Create a new CDK app
        App app = new App();

        // Create the stack
        AlertsStack stack = new AlertsStack(app, "TestAlertsStack", StackProps.builder().build(),
            serviceDefinition, deployment("dev"));

        // Get the CloudFormation template
        Template template = Template.fromStack(stack);

        // Verify SNS Topics
        template.resourceCountIs("AWS::SNS::Topic", 1);
        template.hasResourceProperties("AWS::SNS::Topic", Match.objectLike(Map.of(
            "TopicName", "orders-alerts",
            "Subscription", List.of(Map.of(
                "Protocol", "email",
                "Endpoint", "oncall@example.com"
            ))
        )));

        // Verify CloudWatch Alarms
        template.resourceCountIs("AWS::CloudWatch::Alarm", 5);
        template.hasResourceProperties("AWS::CloudWatch::Alarm", Match.objectLike(Map.of(
            "AlarmName", "orders-dev-create-order-Errors",
            "Threshold", 3,
            "AlarmActions", List.of(
                Map.of("Ref", "AwsAlertsAlarm"),
                "arn:aws:sns:us-east-1:123456789012:pager"
            ),
            "Dimensions", List.of(Map.of(
                "Name", "FunctionName",
                "Value", "orders-dev-create-order"
            ))
        )));
        template.hasResourceProperties("AWS::CloudWatch::Alarm", Match.objectLike(Map.of(
            "AlarmName", "orders-dev-getOrder-Errors",
            "Threshold", 1,
            "AlarmActions", List.of(Map.of("Ref", "AwsAlertsAlarm"))
        )));

        // Verify log metric filters
        template.resourceCountIs("AWS::Logs::MetricFilter", 4);
        template.hasResourceProperties("AWS::Logs::MetricFilter", Match.objectLike(Map.of(
            "FilterPattern", "\"Bad Request\"",
            "LogGroupName", "/aws/lambda/orders-dev-create-order"
        )));

        // Verify composite alarm
        template.resourceCountIs("AWS::CloudWatch::CompositeAlarm", 1);
        template.hasResourceProperties("AWS::CloudWatch::CompositeAlarm", Match.objectLike(Map.of(
            "AlarmName", "orders-dev-us-east-1-OrderFailures",
            "AlarmDescription", "Any order function failing",
            "AlarmRule", Match.stringLikeRegexp("ALARM\\(orders-dev-create-order-Errors\\) OR .*"),
            "AlarmActions", List.of(Map.of("Ref", "AwsAlertsAlarm"))
        )));

        // Verify dashboard
        template.resourceCountIs("AWS::CloudWatch::Dashboard", 1);
        template.hasResourceProperties("AWS::CloudWatch::Dashboard", Match.objectLike(Map.of(
            "DashboardName", "orders-dev-us-east-1"
        )));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testLogicalIdsArePinned() {
        App app = new App();
        AlertsStack stack = new AlertsStack(app, "TestAlertsStack", StackProps.builder().build(),
            serviceDefinition, deployment("dev"));

        Map<String, Object> resources = (Map<String, Object>) Template.fromStack(stack).toJSON().get("Resources");

        assertTrue(resources.containsKey("AwsAlertsAlarm"));
        assertTrue(resources.containsKey("CreateDashorderFunctionErrorsAlarm"));
        assertTrue(resources.containsKey("GetOrderBadRequestsAlarm"));
        assertTrue(resources.containsKey("AlertsCompositeOrderFailures"));
        assertTrue(resources.containsKey("AlertsDashboard"));

        // Log groups belong to the service stack, so metric filters carry no DependsOn here
        Map<String, Object> filter = (Map<String, Object>)
            resources.get("CreateDashorderLambdaFunctionBadRequestsLogMetricFilterALERT");
        assertFalse(filter.containsKey("DependsOn"));

        Map<String, Object> composite = (Map<String, Object>) resources.get("AlertsCompositeOrderFailures");
        assertEquals(5, ((List<Object>) composite.get("DependsOn")).size());
    }

    @Test
    public void testStageWithoutAlerts() {
        App app = new App();
        AlertsStack stack = new AlertsStack(app, "TestAlertsStack", StackProps.builder().build(),
            serviceDefinition, deployment("qa"));

        Template template = Template.fromStack(stack);

        template.resourceCountIs("AWS::CloudWatch::Alarm", 0);
        template.resourceCountIs("AWS::SNS::Topic", 0);
    }

    private static DeploymentContext deployment(String stage) {
        return DeploymentContext.builder()
            .service("orders")
            .stage(stage)
            .region("us-east-1")
            .build();
    }
}
