package io.aegis.core.authorize;

import io.aegis.core.audit.AuditStore;
import io.aegis.core.audit.AuditTrail;
import io.aegis.core.audit.FileAuditStore;
import io.aegis.core.audit.InMemoryAuditStore;
import io.aegis.core.config.ConfigPaths;
import io.aegis.core.config.model.AegisConfig;
import io.aegis.core.config.model.AuditConfig;
import io.aegis.core.confirmation.ConfirmationManager;
import io.aegis.core.exec.ProcessRunner;
import io.aegis.core.middleware.SecretsDetector;
import io.aegis.core.policy.PolicyEngine;
import io.aegis.core.policy.PolicyException;
import io.aegis.core.policy.SecurityPolicy;
import io.aegis.core.safety.ResourceProbe;
import io.aegis.core.safety.SafetyManager;
import io.aegis.core.sandbox.Sandbox;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every enforcement component for the lifetime of the process. Built once from
 * configuration; {@link #close()} stops the process supervision pool.
 */
public final class AegisContext implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AegisContext.class);
    private static final long MB = 1024L * 1024L;

    private final AegisConfig config;
    private final ProcessRunner runner;
    private final Sandbox sandbox;
    private final PolicyEngine policyEngine;
    private final SafetyManager safetyManager;
    private final ConfirmationManager confirmationManager;
    private final AuditTrail auditTrail;
    private final ActionAuthorizer authorizer;

    private AegisContext(
        AegisConfig config,
        ProcessRunner runner,
        Sandbox sandbox,
        PolicyEngine policyEngine,
        SafetyManager safetyManager,
        ConfirmationManager confirmationManager,
        AuditTrail auditTrail,
        ActionAuthorizer authorizer
    ) {
        this.config = config;
        this.runner = runner;
        this.sandbox = sandbox;
        this.policyEngine = policyEngine;
        this.safetyManager = safetyManager;
        this.confirmationManager = confirmationManager;
        this.auditTrail = auditTrail;
        this.authorizer = authorizer;
    }

    public static AegisContext create(AegisConfig config, Clock clock, ResourceProbe probe) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(probe, "probe must not be null");

        ProcessRunner runner = new ProcessRunner();
        Sandbox sandbox = new Sandbox(config.sandbox(), runner);
        PolicyEngine policyEngine = new PolicyEngine(clock);
        applyPolicyConfig(policyEngine, config);
        SafetyManager safetyManager = new SafetyManager(config.safety(), runner, probe, clock);
        ConfirmationManager confirmationManager = new ConfirmationManager();
        SecretsDetector secretsDetector = new SecretsDetector();
        AuditTrail auditTrail = new AuditTrail(auditStore(config.audit()), clock, secretsDetector, config.audit().structuredLogging());
        ActionAuthorizer authorizer = new ActionAuthorizer(
            policyEngine,
            sandbox,
            safetyManager,
            confirmationManager,
            secretsDetector,
            auditTrail
        );
        LOG.debug("Aegis context ready with {} policies", policyEngine.policies().size());
        return new AegisContext(config, runner, sandbox, policyEngine, safetyManager, confirmationManager, auditTrail, authorizer);
    }

    public AegisConfig config() {
        return config;
    }

    public Sandbox sandbox() {
        return sandbox;
    }

    public PolicyEngine policyEngine() {
        return policyEngine;
    }

    public SafetyManager safetyManager() {
        return safetyManager;
    }

    public ConfirmationManager confirmationManager() {
        return confirmationManager;
    }

    public AuditTrail auditTrail() {
        return auditTrail;
    }

    public ActionAuthorizer authorizer() {
        return authorizer;
    }

    @Override
    public void close() {
        runner.close();
    }

    private static void applyPolicyConfig(PolicyEngine engine, AegisConfig config) {
        for (SecurityPolicy policy : config.policy().additionalPolicies()) {
            engine.addPolicy(policy);
        }
        for (String id : config.policy().disabledPolicies()) {
            try {
                engine.setPolicyEnabled(id, false);
            } catch (PolicyException e) {
                LOG.warn("Ignoring disabled policy entry: {}", e.getMessage());
            }
        }
    }

    private static AuditStore auditStore(AuditConfig audit) {
        if (!audit.enabled()) {
            return new InMemoryAuditStore();
        }
        return new FileAuditStore(ConfigPaths.resolve(audit.directory()), audit.maxFileSizeMb() * MB, audit.maxFiles());
    }
}
