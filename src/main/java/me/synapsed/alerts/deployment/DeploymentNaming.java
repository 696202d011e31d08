package me.synapsed.alerts.deployment;

import java.util.List;

import me.synapsed.alerts.model.FunctionContext;

/**
 * Identifier scheme of the deployment the alerts are compiled into.
 */
public interface DeploymentNaming {

    /**
     * Logical id of the function resource, referenced by alarm dimensions.
     */
    String functionLogicalId(String functionName);

    /**
     * Logical id of the function's log group resource, which metric filters depend on.
     */
    String logGroupLogicalId(String functionName);

    /**
     * Physical log group name for a deployed function name.
     */
    String logGroupName(String deployedFunctionName);

    String stackName();

    /**
     * Value of the {@code FunctionName} alarm dimension.
     */
    Object functionReference(FunctionContext function);

    /**
     * Logical ids a function's metric filters are created after.
     */
    List<String> logGroupDependencies(FunctionContext function);
}
