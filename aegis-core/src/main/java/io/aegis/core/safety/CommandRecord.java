package io.aegis.core.safety;

import java.time.Instant;

/**
 * @param reason          why the command was blocked, or {@code null}
 * @param executionTimeMs wall-clock time, or {@code null} when the command never ran
 */
public record CommandRecord(
    String command,
    Instant timestamp,
    String user,
    boolean blocked,
    String reason,
    Long executionTimeMs
) {
}
