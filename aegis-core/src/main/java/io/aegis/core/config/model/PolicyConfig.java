package io.aegis.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.aegis.core.policy.SecurityPolicy;
import java.util.List;

/**
 * Adjustments applied on top of the built-in policy table.
 *
 * @param additionalPolicies policies added after the built-ins
 * @param disabledPolicies   ids of built-in or additional policies to switch off
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyConfig(
    List<SecurityPolicy> additionalPolicies,
    List<String> disabledPolicies
) {

    public PolicyConfig {
        additionalPolicies = additionalPolicies == null ? List.of() : List.copyOf(additionalPolicies);
        disabledPolicies = disabledPolicies == null ? List.of() : List.copyOf(disabledPolicies);
    }

    public static PolicyConfig defaults() {
        return new PolicyConfig(List.of(), List.of());
    }
}
