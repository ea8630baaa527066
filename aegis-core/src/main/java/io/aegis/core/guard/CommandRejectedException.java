package io.aegis.core.guard;

import java.util.Objects;

public final class CommandRejectedException extends Exception {
    private final ErrorKind kind;
    private final String reason;

    public CommandRejectedException(ErrorKind kind, String reason) {
        this(kind, reason, null);
    }

    public CommandRejectedException(ErrorKind kind, String reason, Throwable cause) {
        super("[" + Objects.requireNonNull(kind, "kind must not be null").label() + "] " + reason, cause);
        this.kind = kind;
        this.reason = reason == null || reason.isBlank() ? kind.label() : reason;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String reason() {
        return reason;
    }
}
