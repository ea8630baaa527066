package io.aegis.cli;

import picocli.CommandLine.Command;

@Command(name = "aegis", mixinStandardHelpOptions = true, description = "Authorize and safely run agent-proposed commands")
public final class AegisCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
