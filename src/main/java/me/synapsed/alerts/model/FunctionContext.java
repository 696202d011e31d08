package me.synapsed.alerts.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import me.synapsed.alerts.config.AlarmReference;

/**
 * Read-only view of one function while its alarms are expanded.
 */
@Value
@Builder
public class FunctionContext {
    /** Key of the function in the service definition. */
    String name;
    /** Deployed function name. */
    String deployedName;
    String logicalId;
    String logGroupLogicalId;
    String logGroupName;
    @Builder.Default
    List<AlarmReference> alarms = List.of();
}
