package me.synapsed.alerts.compiler;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;
import me.synapsed.alerts.config.AlertsConfig;
import me.synapsed.alerts.config.ConfigLoader;
import me.synapsed.alerts.dashboards.DashboardRenderer;
import me.synapsed.alerts.deployment.DeploymentNaming;
import me.synapsed.alerts.deployment.FunctionDefinition;
import me.synapsed.alerts.deployment.FunctionRegistry;
import me.synapsed.alerts.document.ResourceDocument;
import me.synapsed.alerts.model.AlarmSpec;
import me.synapsed.alerts.model.DeploymentContext;
import me.synapsed.alerts.model.FunctionContext;

/**
 * Runs one compile pass: definitions, topics, per-function alarms, composite alarms, dashboards.
 * Composite alarms read the alarms emitted earlier in the same pass, so the order is fixed.
 */
@Slf4j
public class AlertsCompiler {
    private final FunctionRegistry functions;
    private final DeploymentNaming naming;
    private final DeploymentContext deployment;
    private final Map<String, ObjectNode> builtInDefinitions;

    private final DefinitionResolver definitionResolver;
    private final TopicSynthesizer topicSynthesizer;
    private final AlarmSetExpander alarmSetExpander;
    private final CompositeResolver compositeResolver;
    private final DashboardCompiler dashboardCompiler;

    public AlertsCompiler(FunctionRegistry functions, DeploymentNaming naming, DeploymentContext deployment,
                          DashboardRenderer dashboardRenderer) {
        this(functions, naming, deployment, dashboardRenderer, ConfigLoader.loadBuiltInDefinitions());
    }

    public AlertsCompiler(FunctionRegistry functions, DeploymentNaming naming, DeploymentContext deployment,
                          DashboardRenderer dashboardRenderer, Map<String, ObjectNode> builtInDefinitions) {
        this.functions = functions;
        this.naming = naming;
        this.deployment = deployment;
        this.builtInDefinitions = builtInDefinitions;

        this.definitionResolver = new DefinitionResolver();
        this.topicSynthesizer = new TopicSynthesizer();
        this.alarmSetExpander = new AlarmSetExpander(definitionResolver, new AlarmResourceBuilder(naming));
        this.compositeResolver = new CompositeResolver(deployment);
        this.dashboardCompiler = new DashboardCompiler(deployment, dashboardRenderer);
    }

    public void compile(AlertsConfig config, ResourceDocument document) {
        if (config == null) {
            log.info("No alerts configuration found, nothing to compile");
            return;
        }

        if (!config.isDeployedOnStage(deployment.getStage())) {
            log.warn("Not deploying alerts on stage {}", deployment.getStage());
            return;
        }

        DefinitionTable definitions = definitionResolver.mergeDefinitions(builtInDefinitions, config.getDefinitions());
        ActionTopicTable topics = topicSynthesizer.compileAlertTopics(config.getTopics(), document);

        compileAlarms(config, definitions, topics, document);

        // Composite alarms reference the alarm resources emitted above
        compositeResolver.resolve(definitions, document);

        if (config.hasDashboards()) {
            dashboardCompiler.compileDashboards(config.getDashboards(), deployedFunctionNames(), document);
        }

        log.info("Compiled alerts for {} functions on stage {}", functions.listFunctions().size(), deployment.getStage());
    }

    private void compileAlarms(AlertsConfig config, DefinitionTable definitions, ActionTopicTable topics,
                               ResourceDocument document) {
        List<AlarmSpec> globalAlarms = alarmSetExpander.globalAlarms(config, definitions);
        for (String functionName : functions.listFunctions()) {
            alarmSetExpander.expand(functionContext(functionName), globalAlarms, config, definitions, topics, document);
        }
    }

    FunctionContext functionContext(String functionName) {
        FunctionDefinition function = functions.getFunction(functionName);
        return FunctionContext.builder()
            .name(functionName)
            .deployedName(function.getName())
            .logicalId(naming.functionLogicalId(functionName))
            .logGroupLogicalId(naming.logGroupLogicalId(functionName))
            .logGroupName(naming.logGroupName(function.getName()))
            .alarms(function.getAlarms() == null ? List.of() : function.getAlarms())
            .build();
    }

    private List<String> deployedFunctionNames() {
        return functions.listFunctions().stream()
            .map(functionName -> functions.getFunction(functionName).getName())
            .collect(Collectors.toList());
    }
}
