package io.aegis.core.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CommandGuardTest {

    private final GuardRules rules = GuardRules.of(
        List.of("ls", "cat", "rm", "bash"),
        List.of("rm", "dd"),
        List.of("/etc", "/sys"),
        List.of("rm\\s+-rf\\s+/", "&&")
    );

    @Test
    void shouldLetBlockListWinOverAllowList() {
        assertThatThrownBy(() -> CommandGuard.check(rules, "rm", List.of("notes.txt")))
            .isInstanceOfSatisfying(CommandRejectedException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.BLOCKED_COMMAND);
                assertThat(e.reason()).isEqualTo("Command 'rm' is blocked for security reasons");
            });
    }

    @Test
    void shouldMatchProgramsByBaseName() {
        Optional<CommandRejectedException> violation = CommandGuard.findViolation(rules, "/bin/dd", List.of("if=/dev/zero"));

        assertThat(violation).isPresent();
        assertThat(violation.get().kind()).isEqualTo(ErrorKind.BLOCKED_COMMAND);
    }

    @Test
    void shouldRejectBlockedProgramWrappedInAllowedOne() {
        assertThat(CommandGuard.findViolation(rules, "bash", List.of("-c", "cat x; /bin/dd if=/dev/zero")))
            .map(CommandRejectedException::reason)
            .contains("Command 'dd' is blocked for security reasons");
        assertThat(CommandGuard.findViolation(rules, "bash", List.of("-c", "(rm notes.txt)")))
            .map(CommandRejectedException::kind)
            .contains(ErrorKind.BLOCKED_COMMAND);
        assertThat(CommandGuard.findViolation(rules, "cat", List.of("--format=dd.txt"))).isEmpty();
    }

    @Test
    void shouldMatchBuiltInDestructiveVerbsOnWordBoundaries() {
        GuardRules builtIn = GuardRules.of(List.of(), List.of(), List.of(), GuardRules.BUILT_IN_DANGEROUS_PATTERNS);

        assertThat(CommandGuard.findViolation(builtIn, "sudo", List.of("shutdown", "-h", "now")))
            .map(CommandRejectedException::kind).contains(ErrorKind.DANGEROUS_PATTERN);
        assertThat(CommandGuard.findViolation(builtIn, "sudo", List.of("mkfs", "/x")))
            .map(CommandRejectedException::kind).contains(ErrorKind.DANGEROUS_PATTERN);
        assertThat(CommandGuard.findViolation(builtIn, "echo", List.of("halting", "rebooting"))).isEmpty();
    }

    @Test
    void shouldRejectProgramsOutsideAllowList() {
        Optional<CommandRejectedException> violation = CommandGuard.findViolation(rules, "sleep", List.of("1"));

        assertThat(violation).map(CommandRejectedException::kind).contains(ErrorKind.NOT_WHITELISTED);
        assertThat(violation.get().reason()).isEqualTo("Command 'sleep' is not in the allowed commands list");
    }

    @Test
    void shouldRejectDangerousPatternEvenWhenAllowed() {
        Optional<CommandRejectedException> violation = CommandGuard.findViolation(rules, "bash", List.of("-c", "ls && ls"));

        assertThat(violation).map(CommandRejectedException::kind).contains(ErrorKind.DANGEROUS_PATTERN);
        assertThat(violation.get().reason()).isEqualTo("Command matches dangerous pattern: &&");
    }

    @Test
    void shouldRejectProtectedPathsIncludingNormalizedAndAssignedForms() {
        assertThat(CommandGuard.findViolation(rules, "cat", List.of("/etc/passwd")))
            .map(CommandRejectedException::kind).contains(ErrorKind.BLOCKED_PATH);
        assertThat(CommandGuard.findViolation(rules, "cat", List.of("/tmp/../etc/shadow")))
            .map(CommandRejectedException::kind).contains(ErrorKind.BLOCKED_PATH);
        assertThat(CommandGuard.findViolation(rules, "ls", List.of("--dir=/sys/kernel")))
            .map(CommandRejectedException::kind).contains(ErrorKind.BLOCKED_PATH);
    }

    @Test
    void shouldNotTreatSiblingDirectoriesAsProtected() {
        assertThat(CommandGuard.findViolation(rules, "ls", List.of("/etcetera/file"))).isEmpty();
        assertThat(CommandGuard.findViolation(rules, "ls", List.of("-la", "/tmp"))).isEmpty();
    }

    @Test
    void shouldProtectRootOnlyByExactMatch() {
        GuardRules rootOnly = GuardRules.of(List.of(), List.of(), List.of("/"), List.of());

        assertThat(CommandGuard.findViolation(rootOnly, "ls", List.of("/"))).isPresent();
        assertThat(CommandGuard.findViolation(rootOnly, "ls", List.of("/home/user"))).isEmpty();
    }

    @Test
    void shouldRejectEmptyProgram() {
        assertThat(CommandGuard.findViolation(rules, "  ", List.of()))
            .map(CommandRejectedException::kind).contains(ErrorKind.EMPTY_COMMAND);
    }

    @Test
    void shouldFailFastOnInvalidPattern() {
        assertThatThrownBy(() -> GuardRules.compile(List.of("([unclosed")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("([unclosed");
    }
}
