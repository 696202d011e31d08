package me.synapsed.alerts.dashboards;

import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import me.synapsed.alerts.errors.AlertsConfigurationException;
import me.synapsed.alerts.model.DeploymentContext;

/**
 * Dashboards charting the standard Lambda metrics of every function.
 * {@code default} lays the widgets out in two columns, {@code vertical} stacks them full width.
 */
public class LambdaDashboardRenderer implements DashboardRenderer {
    public static final String DEFAULT_TEMPLATE = "default";
    public static final String VERTICAL_TEMPLATE = "vertical";

    private static final String LAMBDA_NAMESPACE = "AWS/Lambda";
    private static final int WIDGET_HEIGHT = 6;
    private static final int PERIOD_SECONDS = 300;

    private static final List<WidgetMetric> METRICS = List.of(
        new WidgetMetric("Invocations", "Sum"),
        new WidgetMetric("Errors", "Sum"),
        new WidgetMetric("Duration", "Average"),
        new WidgetMetric("Throttles", "Sum"));

    @Override
    public ObjectNode render(DeploymentContext deployment, List<String> functionNames, String template) {
        int columns;
        if (DEFAULT_TEMPLATE.equals(template)) {
            columns = 2;
        } else if (VERTICAL_TEMPLATE.equals(template)) {
            columns = 1;
        } else {
            throw new AlertsConfigurationException("Unknown dashboard template " + template);
        }
        int width = 24 / columns;

        ObjectNode body = JsonNodeFactory.instance.objectNode();
        ArrayNode widgets = body.putArray("widgets");
        for (int i = 0; i < METRICS.size(); i++) {
            WidgetMetric metric = METRICS.get(i);
            ObjectNode widget = widgets.addObject();
            widget.put("type", "metric");
            widget.put("x", (i % columns) * width);
            widget.put("y", (i / columns) * WIDGET_HEIGHT);
            widget.put("width", width);
            widget.put("height", WIDGET_HEIGHT);

            ObjectNode properties = widget.putObject("properties");
            properties.put("title", metric.name);
            properties.put("view", "timeSeries");
            properties.put("stacked", false);
            properties.put("region", deployment.getRegion());
            properties.put("period", PERIOD_SECONDS);
            properties.put("stat", metric.stat);

            ArrayNode metrics = properties.putArray("metrics");
            for (String functionName : functionNames) {
                metrics.addArray()
                    .add(LAMBDA_NAMESPACE)
                    .add(metric.name)
                    .add("FunctionName")
                    .add(functionName);
            }
        }
        return body;
    }

    private static final class WidgetMetric {
        private final String name;
        private final String stat;

        private WidgetMetric(String name, String stat) {
            this.name = name;
            this.stat = stat;
        }
    }
}
