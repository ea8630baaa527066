package io.aegis.core.sandbox;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record ParsedCommand(String program, List<String> args) {

    public ParsedCommand {
        Objects.requireNonNull(program, "program must not be null");
        args = args == null ? List.of() : List.copyOf(args);
    }

    public List<String> argv() {
        ArrayList<String> argv = new ArrayList<>(args.size() + 1);
        argv.add(program);
        argv.addAll(args);
        return List.copyOf(argv);
    }
}
