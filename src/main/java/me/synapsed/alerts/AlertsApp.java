package me.synapsed.alerts;

import java.nio.file.Paths;

import lombok.extern.slf4j.Slf4j;
import me.synapsed.alerts.config.ConfigLoader;
import me.synapsed.alerts.config.ServiceDefinition;
import me.synapsed.alerts.deployment.ServerlessNaming;
import me.synapsed.alerts.model.DeploymentContext;
import me.synapsed.alerts.stacks.AlertsStack;
import software.amazon.awscdk.App;
import software.amazon.awscdk.Environment;
import software.amazon.awscdk.StackProps;

@Slf4j
public class AlertsApp {
    public static void main(final String[] args) {
        App app = new App();

        // Read the deployment descriptor location from CDK context (e.g., cdk.json or CLI --context)
        String serviceFile = contextValue(app, "serviceFile", "serverless.yml");
        ServiceDefinition serviceDefinition = ConfigLoader.loadServiceDefinition(Paths.get(serviceFile));

        // Stage and region given on the command line win over the descriptor
        DeploymentContext deployment = DeploymentContext.builder()
            .service(serviceDefinition.getService())
            .stage(contextValue(app, "stage", serviceDefinition.getProvider().getStage()))
            .region(contextValue(app, "region", serviceDefinition.getProvider().getRegion()))
            .build();

        String stackName = new ServerlessNaming(deployment, serviceDefinition.getProvider().getStackName())
            .stackName() + "-alerts";
        log.info("Synthesizing {} for stage {} in {}", stackName, deployment.getStage(), deployment.getRegion());

        StackProps props = StackProps.builder()
            .stackName(stackName)
            .env(Environment.builder()
                .account(System.getenv("CDK_DEFAULT_ACCOUNT"))
                .region(deployment.getRegion())
                .build())
            .build();

        new AlertsStack(app, "AlertsStack", props, serviceDefinition, deployment);

        app.synth();
    }

    private static String contextValue(App app, String key, String defaultValue) {
        Object value = app.getNode().tryGetContext(key);
        return value != null ? value.toString() : defaultValue;
    }
}
