package me.synapsed.alerts.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Builder;
import lombok.Value;

/**
 * A single CloudFormation resource declaration, keyed by logical id in a
 * {@link me.synapsed.alerts.document.ResourceDocument}.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"Type", "DependsOn", "Properties"})
public class Resource {
    @JsonProperty("Type")
    String type;

    @JsonProperty("DependsOn")
    @Builder.Default
    List<String> dependsOn = List.of();

    @JsonProperty("Properties")
    @Builder.Default
    Map<String, Object> properties = new LinkedHashMap<>();

    public boolean isOfType(String resourceType) {
        return resourceType.equals(type);
    }

    public Optional<Object> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    /**
     * Resources carrying {@code enabled: false} in their properties are treated as switched off.
     */
    @JsonIgnore
    public boolean isDisabled() {
        return Boolean.FALSE.equals(properties.get("enabled"));
    }
}
