package io.aegis.cli;

import io.aegis.core.policy.SecurityPolicy;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "policies", description = "List security policies in evaluation order")
public final class PoliciesCommand implements Callable<Integer> {
    private final CliContext context;

    public PoliciesCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            for (SecurityPolicy policy : context.aegis().policyEngine().policies()) {
                String reason = policy.action().reason().isEmpty() ? "" : " (" + policy.action().reason() + ")";
                System.out.printf("%4d  %-28s %-8s %s%s%n",
                    policy.priority(),
                    policy.id(),
                    policy.enabled() ? "enabled" : "disabled",
                    policy.action().type(),
                    reason);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Policies command failed: " + e.getMessage());
            return 1;
        }
    }
}
