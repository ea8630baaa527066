package io.aegis.core.authorize;

import io.aegis.core.guard.CommandGuard;
import io.aegis.core.middleware.SecretsDetector;
import io.aegis.core.policy.PolicyRequest;
import io.aegis.core.policy.RiskAssessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the policy view of a proposed command.
 */
final class PolicyRequests {
    static final Set<String> NETWORK_PROGRAMS = Set.of(
        "curl", "wget", "ssh", "scp", "sftp", "ftp", "rsync", "nc", "ncat", "telnet", "ping"
    );

    private PolicyRequests() {
    }

    static PolicyRequest from(ActionRequest request, SecretsDetector secretsDetector) {
        String commandLine = request.commandLine();
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("command", commandLine);

        List<String> paths = new ArrayList<>();
        for (String arg : request.args()) {
            if (CommandGuard.looksLikePath(arg)) {
                parameters.put("path." + paths.size(), arg);
                paths.add(arg);
            }
        }

        return PolicyRequest.builder(request.toolName())
            .userId(request.userId())
            .parameters(parameters)
            .resourceLimits(request.limits())
            .containsSecrets(secretsDetector.containsSecrets(commandLine))
            .networkAccess(usesNetwork(request))
            .filePaths(paths)
            .riskAssessment(RiskAssessor.assess(request.toolName(), parameters))
            .build();
    }

    static boolean usesNetwork(ActionRequest request) {
        if (NETWORK_PROGRAMS.contains(CommandGuard.commandName(request.program()))) {
            return true;
        }
        return request.args().stream().anyMatch(arg -> arg.contains("://"));
    }
}
