package io.aegis.cli;

import io.aegis.core.authorize.AegisContext;
import io.aegis.core.config.ConfigPaths;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and enforcement status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            AegisContext aegis = context.aegis();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Policies: " + aegis.policyEngine().policies().size());
            System.out.println("Audit enabled: " + aegis.config().audit().enabled());
            System.out.println("Audit directory: " + ConfigPaths.resolve(aegis.config().audit().directory()));
            System.out.println("Sandbox:");
            print(aegis.sandbox().stats());
            System.out.println("Safety:");
            print(aegis.safetyManager().getStats());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private static void print(Map<String, ?> values) {
        values.forEach((key, value) -> System.out.println("  " + key + ": " + value));
    }
}
