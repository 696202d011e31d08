package me.synapsed.alerts.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import me.synapsed.alerts.config.AlertsConfig;
import me.synapsed.alerts.document.ResourceDocument;
import me.synapsed.alerts.errors.MissingConfigurationException;
import me.synapsed.alerts.model.AlarmSpec;
import me.synapsed.alerts.model.FunctionContext;
import me.synapsed.alerts.model.Resource;
import me.synapsed.alerts.utils.NamingUtils;

/**
 * Expands the global and per-function alarm sets of each function into resources.
 */
@Slf4j
public class AlarmSetExpander {
    private final DefinitionResolver definitionResolver;
    private final AlarmResourceBuilder alarmResourceBuilder;

    public AlarmSetExpander(DefinitionResolver definitionResolver, AlarmResourceBuilder alarmResourceBuilder) {
        this.definitionResolver = definitionResolver;
        this.alarmResourceBuilder = alarmResourceBuilder;
    }

    public List<AlarmSpec> globalAlarms(AlertsConfig config, DefinitionTable definitions) {
        requireContext(config, definitions);
        return definitionResolver.resolveAlarms(config.globalAlarmReferences(), definitions);
    }

    public List<AlarmSpec> functionAlarms(FunctionContext function, AlertsConfig config, DefinitionTable definitions) {
        requireContext(config, definitions);
        return definitionResolver.resolveAlarms(function.getAlarms(), definitions);
    }

    /**
     * Builds every alarm of one function and merges the batch into the document. Disabled alarms
     * are deleted from the document so switching an alarm off removes its earlier resource.
     *
     * @return the batch that was merged
     */
    public Map<String, Resource> expand(FunctionContext function, List<AlarmSpec> globalAlarms, AlertsConfig config,
                                        DefinitionTable definitions, ActionTopicTable topics,
                                        ResourceDocument document) {
        List<AlarmSpec> alarms = new ArrayList<>(globalAlarms);
        alarms.addAll(functionAlarms(function, config, definitions));

        Map<String, Resource> batch = new LinkedHashMap<>();
        for (AlarmSpec declared : alarms) {
            AlarmSpec alarm = declared.withDefaultTemplates(config.getNameTemplate(), config.getPrefixTemplate());
            String logicalId = NamingUtils.alarmLogicalId(alarm.getName(), function.getName());

            if (!alarm.isEnabled()) {
                batch.remove(logicalId);
                document.delete(logicalId);
                log.debug("Alarm {} disabled for function {}", alarm.getName(), function.getName());
                continue;
            }

            alarmResourceBuilder.buildAlarm(topics, alarm, function)
                .ifPresent(resource -> batch.put(logicalId, resource));
            batch.putAll(alarmResourceBuilder.buildLogMetricFilters(alarm, function));
        }

        document.merge(batch);
        log.debug("Merged {} alarm resources for function {}", batch.size(), function.getName());
        return batch;
    }

    private static void requireContext(AlertsConfig config, DefinitionTable definitions) {
        if (config == null) {
            throw new MissingConfigurationException("config");
        }
        if (definitions == null) {
            throw new MissingConfigurationException("definitions");
        }
    }
}
