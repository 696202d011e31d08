package me.synapsed.alerts.deployment;

import java.util.ArrayList;
import java.util.List;

import me.synapsed.alerts.config.ServiceDefinition;
import me.synapsed.alerts.errors.AlertsConfigurationException;
import me.synapsed.alerts.model.DeploymentContext;

/**
 * Function registry backed by the {@code functions} section of a deployment descriptor.
 * Functions without an explicit name deploy as {@code <service>-<stage>-<key>}.
 */
public class ServiceFunctionRegistry implements FunctionRegistry {
    private final ServiceDefinition serviceDefinition;
    private final DeploymentContext deployment;

    public ServiceFunctionRegistry(ServiceDefinition serviceDefinition, DeploymentContext deployment) {
        this.serviceDefinition = serviceDefinition;
        this.deployment = deployment;
    }

    @Override
    public List<String> listFunctions() {
        return new ArrayList<>(serviceDefinition.getFunctions().keySet());
    }

    @Override
    public FunctionDefinition getFunction(String functionName) {
        if (!serviceDefinition.getFunctions().containsKey(functionName)) {
            throw new AlertsConfigurationException("Function " + functionName + " is not defined");
        }
        FunctionDefinition function = serviceDefinition.getFunctions().get(functionName);
        if (function == null) {
            function = new FunctionDefinition();
        }
        String deployedName = function.getName() != null
            ? function.getName()
            : String.format("%s-%s-%s", deployment.getService(), deployment.getStage(), functionName);
        return new FunctionDefinition(deployedName,
            function.getAlarms() == null ? new ArrayList<>() : function.getAlarms());
    }
}
