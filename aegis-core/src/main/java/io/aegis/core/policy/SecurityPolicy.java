package io.aegis.core.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Conditions are OR-combined: the policy applies when any one of them matches.
 */
public record SecurityPolicy(
    String id,
    String name,
    String description,
    List<PolicyCondition> conditions,
    PolicyAction action,
    int priority,
    boolean enabled
) {

    public SecurityPolicy {
        id = id == null ? "" : id.trim();
        name = name == null || name.isBlank() ? id : name.trim();
        description = description == null ? "" : description.trim();
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    // policies loaded from config are enabled unless they say otherwise
    @JsonCreator
    static SecurityPolicy fromJson(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("conditions") List<PolicyCondition> conditions,
        @JsonProperty("action") PolicyAction action,
        @JsonProperty("priority") int priority,
        @JsonProperty("enabled") Boolean enabled
    ) {
        return new SecurityPolicy(id, name, description, conditions, action, priority, enabled == null || enabled);
    }

    public SecurityPolicy withEnabled(boolean value) {
        return new SecurityPolicy(id, name, description, conditions, action, priority, value);
    }
}
