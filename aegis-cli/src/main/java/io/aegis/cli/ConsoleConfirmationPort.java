package io.aegis.cli;

import io.aegis.core.confirmation.ConfirmationPort;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Asks on the terminal. End of input counts as no answer.
 */
public final class ConsoleConfirmationPort implements ConfirmationPort {
    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationPort(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public synchronized String requestConfirmation(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read confirmation", e);
        }
    }
}
