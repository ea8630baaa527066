package io.aegis.cli;

import io.aegis.core.authorize.ActionOutcome;
import io.aegis.core.authorize.ActionRequest;
import io.aegis.core.authorize.ActionStage;
import io.aegis.core.guard.CommandRejectedException;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "check", description = "Evaluate a command against policies and validators without running it")
public final class CheckCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "1..*", description = "Command to check, as one quoted string or as separate words")
    List<String> command;

    @Option(names = {"-u", "--user"}, description = "User on whose behalf the command would run")
    String user;

    @Option(names = {"-t", "--tool"}, description = "Tool name presented to the policy engine", defaultValue = ActionRequest.DEFAULT_TOOL)
    String tool;

    public CheckCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ActionRequest request = CommandWords.toRequest(command, user, tool);
            ActionOutcome outcome = context.aegis().authorizer().assess(request);
            System.out.println("Command: " + request.commandLine());
            if (outcome.decision() != null) {
                System.out.println("Policy: " + outcome.decision().action().type() + " - " + outcome.decision().reason());
                System.out.println("Matched policies: " + String.join(", ", outcome.decision().appliedPolicies()));
            }
            System.out.println("Result: " + outcome.stage() + describe(outcome));
            boolean runnable = outcome.stage() == ActionStage.SANDBOX_VALIDATED
                || outcome.stage() == ActionStage.CONFIRMATION_PENDING;
            return runnable ? 0 : 1;
        } catch (CommandRejectedException e) {
            System.out.println("Result: REJECTED " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Check command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String describe(ActionOutcome outcome) {
        if (outcome.errorKind() != null) {
            return " [" + outcome.errorKind().label() + "] " + outcome.reason();
        }
        if (outcome.stage() == ActionStage.CONFIRMATION_PENDING) {
            return " (confirmation required)";
        }
        return "";
    }
}
