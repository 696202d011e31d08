package me.synapsed.alerts.document;

import java.util.Map;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;
import me.synapsed.alerts.model.Resource;
import software.amazon.awscdk.CfnResource;
import software.amazon.awscdk.CfnResourceProps;
import software.constructs.Construct;

/**
 * Resource document backed by a CDK construct scope, used when alerting resources
 * are deployed in a stack of their own. Every entry becomes a raw {@link CfnResource}
 * whose logical id is pinned to the document key.
 */
@Slf4j
public class StackResourceDocument implements ResourceDocument {
    private final Construct scope;
    private final TemplateResourceDocument entries = new TemplateResourceDocument();

    public StackResourceDocument(Construct scope) {
        this.scope = scope;
    }

    @Override
    public Optional<Resource> get(String logicalId) {
        return entries.get(logicalId);
    }

    @Override
    public void merge(Map<String, Resource> resources) {
        entries.merge(resources);
        resources.keySet().forEach(this::materialize);
    }

    @Override
    public void delete(String logicalId) {
        entries.delete(logicalId);
        if (scope.getNode().tryRemoveChild(logicalId)) {
            log.debug("Removed {} from {}", logicalId, scope.getNode().getPath());
        }
    }

    @Override
    public Map<String, Resource> resources() {
        return entries.resources();
    }

    private void materialize(String logicalId) {
        Resource resource = entries.get(logicalId)
            .orElseThrow(() -> new IllegalStateException("No resource " + logicalId));

        // Replace any construct from an earlier merge of the same id
        scope.getNode().tryRemoveChild(logicalId);

        CfnResource cfnResource = new CfnResource(scope, logicalId,
            CfnResourceProps.builder()
                .type(resource.getType())
                .properties(resource.getProperties())
                .build());
        cfnResource.overrideLogicalId(logicalId);

        if (!resource.getDependsOn().isEmpty()) {
            cfnResource.addOverride("DependsOn", resource.getDependsOn());
        }
    }
}
