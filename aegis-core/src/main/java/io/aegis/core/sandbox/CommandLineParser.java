package io.aegis.core.sandbox;

import io.aegis.core.guard.CommandRejectedException;
import io.aegis.core.guard.ErrorKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a raw command string into program and arguments without ever involving a shell.
 * Single and double quotes group words; there are no escapes. Any shell metacharacter
 * rejects the whole string.
 */
public final class CommandLineParser {
    static final String SHELL_METACHARACTERS = "|&;()<>`${}[]*?~";

    private CommandLineParser() {
    }

    public static ParsedCommand parse(String raw) throws CommandRejectedException {
        String input = raw == null ? "" : raw.trim();
        if (input.isEmpty()) {
            throw new CommandRejectedException(ErrorKind.EMPTY_COMMAND, "Empty command");
        }
        for (int i = 0; i < input.length(); i++) {
            if (SHELL_METACHARACTERS.indexOf(input.charAt(i)) >= 0) {
                throw new CommandRejectedException(
                    ErrorKind.SHELL_METACHARACTER,
                    "Command contains shell metacharacters and must be executed through shell"
                );
            }
        }

        List<String> words = split(input);
        if (words.isEmpty()) {
            throw new CommandRejectedException(ErrorKind.EMPTY_COMMAND, "Empty command");
        }
        return new ParsedCommand(words.get(0), words.subList(1, words.size()));
    }

    private static List<String> split(String input) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inWord = false;
        char quote = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
                inWord = true;
            } else if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(current.toString());
                    current.setLength(0);
                    inWord = false;
                }
            } else {
                current.append(c);
                inWord = true;
            }
        }
        if (inWord) {
            words.add(current.toString());
        }
        return words;
    }
}
