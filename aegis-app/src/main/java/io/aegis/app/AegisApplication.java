package io.aegis.app;

import io.aegis.cli.AegisCliCommand;
import io.aegis.cli.CheckCommand;
import io.aegis.cli.CliContext;
import io.aegis.cli.PoliciesCommand;
import io.aegis.cli.RunCommand;
import io.aegis.cli.StatusCommand;
import io.aegis.core.authorize.AegisContext;
import io.aegis.core.config.ConfigPaths;
import io.aegis.core.config.ConfigService;
import io.aegis.core.config.model.AegisConfig;
import io.aegis.core.safety.JvmResourceProbe;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class AegisApplication {
    private static final Logger LOG = LoggerFactory.getLogger(AegisApplication.class);

    private AegisApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        AegisConfig config = loadConfig(configService, configPath);

        int exitCode;
        try (AegisContext aegis = AegisContext.create(config, Clock.systemDefaultZone(), new JvmResourceProbe())) {
            CliContext context = new CliContext(aegis, configService, configPath);

            CommandLine commandLine = new CommandLine(new AegisCliCommand());
            commandLine.addSubcommand("check", new CheckCommand(context));
            commandLine.addSubcommand("run", new RunCommand(context));
            commandLine.addSubcommand("policies", new PoliciesCommand(context));
            commandLine.addSubcommand("status", new StatusCommand(context));
            // "aegis run ls -la" passes -la through to the command
            commandLine.setUnmatchedOptionsArePositionalParams(true);

            exitCode = commandLine.execute(args);
        }
        System.exit(exitCode);
    }

    private static AegisConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return AegisConfig.defaults();
        }
    }
}
