package me.synapsed.alerts.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;
import me.synapsed.alerts.document.ResourceDocument;
import me.synapsed.alerts.model.AlarmSpec;
import me.synapsed.alerts.model.AlarmType;
import me.synapsed.alerts.model.DeploymentContext;
import me.synapsed.alerts.model.Resource;
import me.synapsed.alerts.model.ResourceTypes;
import me.synapsed.alerts.model.Severity;
import me.synapsed.alerts.utils.Intrinsics;
import me.synapsed.alerts.utils.NamingUtils;

/**
 * Builds composite alarms over the alarm resources already present in the document.
 * Must run after every function's alarms have been expanded.
 */
@Slf4j
public class CompositeResolver {
    static final String DEFAULT_ALARM_ACTION = NamingUtils.topicLogicalId(null, Severity.ALARM);

    private final DeploymentContext deployment;

    public CompositeResolver(DeploymentContext deployment) {
        this.deployment = deployment;
    }

    public void resolve(DefinitionTable definitions, ResourceDocument document) {
        for (String definitionName : definitions.names()) {
            AlarmSpec definition = definitions.spec(definitionName);
            if (definition.alarmType().orElse(null) != AlarmType.COMPOSITE || !definition.isEnabled()) {
                continue;
            }

            buildComposite(definitionName, definition, document).ifPresent(composite -> {
                Map<String, Resource> resources = new LinkedHashMap<>();
                resources.put(NamingUtils.compositeAlarmLogicalId(definitionName), composite);
                document.merge(resources);
            });
        }
    }

    /**
     * @return the composite alarm, or nothing when no alarm resource matches the definition
     */
    Optional<Resource> buildComposite(String definitionName, AlarmSpec definition, ResourceDocument document) {
        List<Map.Entry<String, Resource>> constituents = matchingAlarms(definition.getAlarmsToInclude(), document);
        if (constituents.isEmpty()) {
            log.info("Skipping composite alarm {}: no alarms to include", definitionName);
            return Optional.empty();
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("AlarmName", NamingUtils.compositeAlarmName(deployment, definitionName));
        if (definition.getDescription() != null) {
            properties.put("AlarmDescription", definition.getDescription());
        }
        if (definition.getActionsEnabled() != null) {
            properties.put("ActionsEnabled", definition.getActionsEnabled());
        }
        properties.put("AlarmRule", alarmRule(constituents));
        properties.put("AlarmActions", alarmActions(definition.getAlarmsActions(), document));

        return Optional.of(Resource.builder()
            .type(ResourceTypes.COMPOSITE_ALARM)
            .dependsOn(constituents.stream().map(Map.Entry::getKey).collect(Collectors.toList()))
            .properties(properties)
            .build());
    }

    /**
     * Alarm resources in document order, restricted to {@code alarmsToInclude} unless it is empty.
     * Selection is by what the document contains, not by which alarms are enabled in configuration.
     */
    List<Map.Entry<String, Resource>> matchingAlarms(List<String> alarmsToInclude, ResourceDocument document) {
        boolean includeAll = alarmsToInclude == null || alarmsToInclude.isEmpty();
        return document.resources().entrySet().stream()
            .filter(entry -> entry.getValue().isOfType(ResourceTypes.ALARM))
            .filter(entry -> includeAll || alarmsToInclude.contains(entry.getKey()))
            .map(entry -> Map.entry(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList());
    }

    /**
     * Joins {@code ALARM(name)} terms with {@code OR}. Alarms without an explicit name are
     * referenced through {@code Fn::Sub}, where {@code ${LogicalId}} resolves to the generated name.
     */
    Object alarmRule(List<Map.Entry<String, Resource>> constituents) {
        boolean allNamed = constituents.stream()
            .allMatch(entry -> entry.getValue().property("AlarmName").isPresent());

        List<String> terms = new ArrayList<>();
        for (Map.Entry<String, Resource> entry : constituents) {
            Optional<Object> alarmName = entry.getValue().property("AlarmName");
            if (allNamed) {
                terms.add("ALARM(" + alarmName.get() + ")");
            } else {
                terms.add("ALARM(" + alarmName.map(name -> Intrinsics.escapeSub(String.valueOf(name)))
                    .orElse("${" + entry.getKey() + "}") + ")");
            }
        }

        String rule = String.join(" OR ", terms);
        return allNamed ? rule : Intrinsics.sub(rule);
    }

    /**
     * Refs to the named topics that exist in the document and are not disabled.
     */
    List<Object> alarmActions(List<String> alarmsActions, ResourceDocument document) {
        List<String> requested = alarmsActions == null || alarmsActions.isEmpty()
            ? List.of(DEFAULT_ALARM_ACTION)
            : alarmsActions;

        List<Object> actions = new ArrayList<>();
        for (String action : requested) {
            document.get(action)
                .filter(resource -> resource.isOfType(ResourceTypes.TOPIC))
                .filter(resource -> !resource.isDisabled())
                .ifPresent(resource -> actions.add(Intrinsics.ref(action)));
        }
        return actions;
    }
}
