package io.aegis.core.authorize;

import io.aegis.core.policy.RequestedLimits;
import java.util.List;
import java.util.Objects;

/**
 * A command an agent proposes to run on behalf of a user.
 */
public record ActionRequest(
    String userId,
    String toolName,
    String program,
    List<String> args,
    RequestedLimits limits
) {
    public static final String DEFAULT_TOOL = "shell";

    public ActionRequest {
        userId = userId == null || userId.isBlank() ? "unknown" : userId.trim();
        toolName = toolName == null || toolName.isBlank() ? DEFAULT_TOOL : toolName.trim();
        Objects.requireNonNull(program, "program must not be null");
        args = args == null ? List.of() : List.copyOf(args);
        limits = limits == null ? RequestedLimits.defaults() : limits;
    }

    public static ActionRequest command(String userId, String program, List<String> args) {
        return new ActionRequest(userId, DEFAULT_TOOL, program, args, null);
    }

    public String commandLine() {
        return args.isEmpty() ? program : program + " " + String.join(" ", args);
    }
}
