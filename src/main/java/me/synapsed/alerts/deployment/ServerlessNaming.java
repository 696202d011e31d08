package me.synapsed.alerts.deployment;

import java.util.List;

import me.synapsed.alerts.model.DeploymentContext;
import me.synapsed.alerts.model.FunctionContext;
import me.synapsed.alerts.utils.Intrinsics;
import me.synapsed.alerts.utils.NamingUtils;

/**
 * Naming conventions of the Serverless Framework's AWS provider.
 */
public class ServerlessNaming implements DeploymentNaming {
    private final DeploymentContext deployment;
    private final String stackNameOverride;

    public ServerlessNaming(DeploymentContext deployment) {
        this(deployment, null);
    }

    public ServerlessNaming(DeploymentContext deployment, String stackNameOverride) {
        this.deployment = deployment;
        this.stackNameOverride = stackNameOverride;
    }

    @Override
    public String functionLogicalId(String functionName) {
        return NamingUtils.normalizedName(functionName) + "LambdaFunction";
    }

    @Override
    public String logGroupLogicalId(String functionName) {
        return NamingUtils.normalizedName(functionName) + "LogGroup";
    }

    @Override
    public String logGroupName(String deployedFunctionName) {
        return "/aws/lambda/" + deployedFunctionName;
    }

    @Override
    public String stackName() {
        if (stackNameOverride != null && !stackNameOverride.isEmpty()) {
            return stackNameOverride;
        }
        return String.format("%s-%s", deployment.getService(), deployment.getStage());
    }

    @Override
    public Object functionReference(FunctionContext function) {
        return Intrinsics.ref(function.getLogicalId());
    }

    @Override
    public List<String> logGroupDependencies(FunctionContext function) {
        return function.getLogGroupLogicalId() == null ? List.of() : List.of(function.getLogGroupLogicalId());
    }
}
