package me.synapsed.alerts.deployment;

import java.util.List;

/**
 * The deployment's function inventory.
 */
public interface FunctionRegistry {

    /**
     * @return function keys in declaration order
     */
    List<String> listFunctions();

    FunctionDefinition getFunction(String functionName);
}
