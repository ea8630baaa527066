package io.aegis.cli;

import io.aegis.core.authorize.AegisContext;
import io.aegis.core.config.ConfigService;
import io.aegis.core.confirmation.ConfirmationPort;
import java.nio.file.Path;

public record CliContext(
    AegisContext aegis,
    ConfigService configService,
    Path configPath,
    ConfirmationPort confirmationPort
) {
    public CliContext(AegisContext aegis, ConfigService configService, Path configPath) {
        this(aegis, configService, configPath, new ConsoleConfirmationPort(System.in, System.out));
    }
}
