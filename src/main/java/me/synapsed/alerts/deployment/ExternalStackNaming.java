package me.synapsed.alerts.deployment;

import java.util.List;

import me.synapsed.alerts.model.FunctionContext;

/**
 * Naming for alerts deployed in a stack separate from the functions. The function and log group
 * resources live in the service's own stack, so dimensions use the deployed function name and
 * metric filters carry no dependency on the log group resource.
 */
public class ExternalStackNaming implements DeploymentNaming {
    private final DeploymentNaming serviceNaming;

    public ExternalStackNaming(DeploymentNaming serviceNaming) {
        this.serviceNaming = serviceNaming;
    }

    @Override
    public String functionLogicalId(String functionName) {
        return serviceNaming.functionLogicalId(functionName);
    }

    @Override
    public String logGroupLogicalId(String functionName) {
        return serviceNaming.logGroupLogicalId(functionName);
    }

    @Override
    public String logGroupName(String deployedFunctionName) {
        return serviceNaming.logGroupName(deployedFunctionName);
    }

    @Override
    public String stackName() {
        return serviceNaming.stackName();
    }

    @Override
    public Object functionReference(FunctionContext function) {
        return function.getDeployedName();
    }

    @Override
    public List<String> logGroupDependencies(FunctionContext function) {
        return List.of();
    }
}
