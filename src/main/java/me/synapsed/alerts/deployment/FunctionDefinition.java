package me.synapsed.alerts.deployment;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import me.synapsed.alerts.config.AlarmReference;

/**
 * A function as declared to the deployment: its deployed name and the alarms attached to it.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FunctionDefinition {
    private String name;
    private List<AlarmReference> alarms = new ArrayList<>();
}
