package io.aegis.cli;

import io.aegis.core.authorize.ActionOutcome;
import io.aegis.core.authorize.ActionRequest;
import io.aegis.core.confirmation.ConfirmationPort;
import io.aegis.core.guard.CommandRejectedException;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Authorize and run a command")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "1..*", description = "Command to run, as one quoted string or as separate words")
    List<String> command;

    @Option(names = {"-u", "--user"}, description = "User on whose behalf the command runs")
    String user;

    @Option(names = {"-t", "--tool"}, description = "Tool name presented to the policy engine", defaultValue = ActionRequest.DEFAULT_TOOL)
    String tool;

    @Option(names = {"-y", "--yes"}, description = "Answer 'yes' to any confirmation prompt")
    boolean assumeYes;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ActionRequest request = CommandWords.toRequest(command, user, tool);
            ConfirmationPort port = assumeYes ? ConfirmationPort.answering("yes") : context.confirmationPort();
            ActionOutcome outcome = context.aegis().authorizer().authorize(request, port);
            if (outcome.result() != null) {
                System.out.print(outcome.result().stdout());
                if (!outcome.result().stderr().isEmpty()) {
                    System.err.print(outcome.result().stderr());
                }
            }
            if (outcome.completed()) {
                return 0;
            }
            String kind = outcome.errorKind() == null ? "" : " [" + outcome.errorKind().label() + "]";
            System.err.println(outcome.stage() + kind + ": " + outcome.reason());
            return 1;
        } catch (CommandRejectedException e) {
            System.err.println("REJECTED " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}
