package me.synapsed.alerts.stacks;

import lombok.Getter;
import me.synapsed.alerts.compiler.AlertsCompiler;
import me.synapsed.alerts.config.ServiceDefinition;
import me.synapsed.alerts.dashboards.DashboardRenderer;
import me.synapsed.alerts.dashboards.LambdaDashboardRenderer;
import me.synapsed.alerts.deployment.DeploymentNaming;
import me.synapsed.alerts.deployment.ExternalStackNaming;
import me.synapsed.alerts.deployment.ServerlessNaming;
import me.synapsed.alerts.deployment.ServiceFunctionRegistry;
import me.synapsed.alerts.document.StackResourceDocument;
import me.synapsed.alerts.model.DeploymentContext;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;
import software.amazon.awscdk.Tags;
import software.constructs.Construct;

/**
 * Alerting stack for a serverless service.
 * Holds the alarms, notification topics, metric filters and dashboards compiled from the
 * service's {@code custom.alerts} configuration.
 */
@Getter
public class AlertsStack extends Stack {
    private final DeploymentContext deployment;
    private final DeploymentNaming naming;
    private final StackResourceDocument resourceDocument;

    public AlertsStack(final Construct scope, final String id, final StackProps props,
                       final ServiceDefinition serviceDefinition, final DeploymentContext deployment) {
        this(scope, id, props, serviceDefinition, deployment, new LambdaDashboardRenderer());
    }

    public AlertsStack(final Construct scope, final String id, final StackProps props,
                       final ServiceDefinition serviceDefinition, final DeploymentContext deployment,
                       final DashboardRenderer dashboardRenderer) {
        super(scope, id, props);

        // Add alerting-specific and cost allocation tags
        Tags.of(this).add("Alerting", "Enabled");
        Tags.of(this).add("Service", deployment.getService());
        Tags.of(this).add("Environment", deployment.getStage());
        Tags.of(this).add("ManagedBy", "CDK");

        this.deployment = deployment;
        // Functions and log groups are deployed by the service's own stack
        this.naming = new ExternalStackNaming(
            new ServerlessNaming(deployment, serviceDefinition.getProvider().getStackName()));
        this.resourceDocument = new StackResourceDocument(this);

        // Compile the alerting configuration straight into this stack
        AlertsCompiler compiler = new AlertsCompiler(
            new ServiceFunctionRegistry(serviceDefinition, deployment),
            naming,
            deployment,
            dashboardRenderer);
        compiler.compile(serviceDefinition.alertsConfig(), resourceDocument);
    }
}
