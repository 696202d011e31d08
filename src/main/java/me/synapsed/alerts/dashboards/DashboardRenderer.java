package me.synapsed.alerts.dashboards;

import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;

import me.synapsed.alerts.model.DeploymentContext;

/**
 * Renders the body of a CloudWatch dashboard for a named template.
 */
public interface DashboardRenderer {

    /**
     * @param functionNames deployed names of the functions to chart
     * @throws me.synapsed.alerts.errors.AlertsConfigurationException if the template is unknown
     */
    ObjectNode render(DeploymentContext deployment, List<String> functionNames, String template);
}
