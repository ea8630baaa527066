package io.aegis.cli;

import io.aegis.core.authorize.ActionRequest;
import io.aegis.core.guard.CommandRejectedException;
import io.aegis.core.sandbox.CommandLineParser;
import io.aegis.core.sandbox.ParsedCommand;
import java.util.List;

/**
 * A single quoted argument is parsed as a command string; several arguments are taken as argv.
 */
final class CommandWords {

    private CommandWords() {
    }

    static ActionRequest toRequest(List<String> words, String user, String tool) throws CommandRejectedException {
        ParsedCommand parsed = words.size() == 1
            ? CommandLineParser.parse(words.get(0))
            : new ParsedCommand(words.get(0), words.subList(1, words.size()));
        return new ActionRequest(user, tool, parsed.program(), parsed.args(), null);
    }
}
