package me.synapsed.alerts.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import me.synapsed.alerts.dashboards.DashboardRenderer;
import me.synapsed.alerts.document.ResourceDocument;
import me.synapsed.alerts.errors.AlertsConfigurationException;
import me.synapsed.alerts.model.DeploymentContext;
import me.synapsed.alerts.model.Resource;
import me.synapsed.alerts.model.ResourceTypes;
import me.synapsed.alerts.utils.NamingUtils;

@Slf4j
public class DashboardCompiler {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DeploymentContext deployment;
    private final DashboardRenderer renderer;

    public DashboardCompiler(DeploymentContext deployment, DashboardRenderer renderer) {
        this.deployment = deployment;
        this.renderer = renderer;
    }

    /**
     * Resolves the {@code dashboards} setting to template names for the current stage.
     */
    public List<String> dashboardTemplates(JsonNode dashboards, String stage) {
        List<String> templates = new ArrayList<>();
        if (dashboards == null || dashboards.isNull()) {
            return templates;
        }
        if (dashboards.isBoolean()) {
            templates.add(NamingUtils.DEFAULT_DASHBOARD_TEMPLATE);
        } else if (dashboards.isTextual()) {
            templates.add(dashboards.asText());
        } else if (dashboards.isObject()) {
            if (dashboards.has("stages") && !containsText(dashboards.get("stages"), stage)) {
                log.info("Not deploying dashboards on stage {}", stage);
                return templates;
            }
            JsonNode configured = dashboards.get("templates");
            if (configured == null || configured.isNull()) {
                templates.add(NamingUtils.DEFAULT_DASHBOARD_TEMPLATE);
            } else {
                addNames(templates, configured);
            }
        } else {
            addNames(templates, dashboards);
        }
        return templates;
    }

    /**
     * Emits one dashboard per distinct template and merges them into the document.
     */
    public Map<String, Resource> compileDashboards(JsonNode dashboards, List<String> functionNames,
                                                   ResourceDocument document) {
        Set<String> templates = new LinkedHashSet<>(dashboardTemplates(dashboards, deployment.getStage()));

        Map<String, Resource> resources = new LinkedHashMap<>();
        for (String template : templates) {
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("DashboardName", NamingUtils.dashboardName(deployment, template));
            properties.put("DashboardBody", body(functionNames, template));

            resources.put(NamingUtils.dashboardLogicalId(template), Resource.builder()
                .type(ResourceTypes.DASHBOARD)
                .properties(properties)
                .build());
        }
        document.merge(resources);
        return resources;
    }

    private String body(List<String> functionNames, String template) {
        try {
            return MAPPER.writeValueAsString(renderer.render(deployment, functionNames, template));
        } catch (JsonProcessingException e) {
            throw new AlertsConfigurationException("Failed to render dashboard " + template, e);
        }
    }

    private static boolean containsText(JsonNode values, String value) {
        if (values.isArray()) {
            for (JsonNode element : values) {
                if (element.asText().equals(value)) {
                    return true;
                }
            }
            return false;
        }
        return values.asText().equals(value);
    }

    private static void addNames(List<String> names, JsonNode values) {
        if (values.isArray()) {
            values.forEach(value -> names.add(value.asText()));
        } else {
            names.add(values.asText());
        }
    }
}
