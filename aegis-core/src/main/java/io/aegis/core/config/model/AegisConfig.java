package io.aegis.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AegisConfig(
    SandboxConfig sandbox,
    SafetyConfig safety,
    PolicyConfig policy,
    AuditConfig audit
) {

    public AegisConfig {
        sandbox = sandbox == null ? SandboxConfig.defaults() : sandbox;
        safety = safety == null ? SafetyConfig.defaults() : safety;
        policy = policy == null ? PolicyConfig.defaults() : policy;
        audit = audit == null ? AuditConfig.defaults() : audit;
    }

    public static AegisConfig defaults() {
        return new AegisConfig(
            SandboxConfig.defaults(),
            SafetyConfig.defaults(),
            PolicyConfig.defaults(),
            AuditConfig.defaults()
        );
    }
}
