package me.synapsed.alerts.model;

/**
 * CloudFormation resource type names emitted by the compiler.
 */
public final class ResourceTypes {
    public static final String ALARM = "AWS::CloudWatch::Alarm";
    public static final String COMPOSITE_ALARM = "AWS::CloudWatch::CompositeAlarm";
    public static final String DASHBOARD = "AWS::CloudWatch::Dashboard";
    public static final String METRIC_FILTER = "AWS::Logs::MetricFilter";
    public static final String TOPIC = "AWS::SNS::Topic";

    private ResourceTypes() {
    }
}
