package io.aegis.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.aegis.core.exec.ProcessRunner;
import io.aegis.core.guard.CommandRejectedException;
import io.aegis.core.policy.PolicyEngine;
import io.aegis.core.policy.PolicyRequest;
import io.aegis.core.safety.SafetyManager;
import io.aegis.core.sandbox.Sandbox;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * Known-destructive commands must be refused by each enforcement layer on its own.
 */
class DefenseInDepthTest {
    private static final List<List<String>> DESTRUCTIVE = List.of(
        List.of("rm", "-rf", "/"),
        List.of("mkfs.ext4", "/dev/sda1"),
        List.of("dd", "if=/dev/zero", "of=/dev/sda"),
        List.of("shutdown", "-h", "now"),
        List.of("reboot"),
        List.of("bash", "-c", ":(){ :|:& }; :"),
        List.of("chmod", "777", "/"),
        List.of("sudo", "rm", "-rf", "/tmp"),
        List.of("bash", "-c", "reboot"),
        List.of("sudo", "reboot"),
        List.of("sudo", "shutdown", "-h", "now"),
        List.of("sudo", "mkfs", "/x"),
        List.of("bash", "-c", "sudo /sbin/halt"),
        List.of("systemctl", "poweroff")
    );

    private final ProcessRunner runner = new ProcessRunner();
    private final Sandbox sandbox = new Sandbox(runner);
    private final SafetyManager safetyManager = new SafetyManager(runner);

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Test
    void shouldBeRejectedBySandbox() {
        for (List<String> argv : DESTRUCTIVE) {
            assertThatThrownBy(() -> sandbox.validateCommand(argv.get(0), argv.subList(1, argv.size())))
                .as(String.join(" ", argv))
                .isInstanceOf(CommandRejectedException.class);
        }
    }

    @Test
    void shouldBeRejectedBySafetyManager() {
        for (List<String> argv : DESTRUCTIVE) {
            assertThatThrownBy(() -> safetyManager.checkCommand(argv.get(0), argv.subList(1, argv.size())))
                .as(String.join(" ", argv))
                .isInstanceOf(CommandRejectedException.class);
        }
    }

    @Test
    void shouldNeverPassOneLayerThatAnotherDenies() {
        PolicyEngine engine = new PolicyEngine();
        for (List<String> argv : DESTRUCTIVE) {
            String commandLine = String.join(" ", argv);
            boolean policyDenies = engine.evaluate(PolicyRequest.builder("shell").parameter("command", commandLine).build()).isDenied();
            boolean sandboxRejects = sandbox.testCommand(argv.get(0), argv.subList(1, argv.size())).isPresent();
            boolean safetyRejects = safetyRejects(argv);

            if (policyDenies) {
                assertThat(sandboxRejects).as("sandbox: " + commandLine).isTrue();
                assertThat(safetyRejects).as("safety: " + commandLine).isTrue();
            }
        }
    }

    @Test
    void shouldBeDeniedByPolicyEngine() {
        PolicyEngine engine = new PolicyEngine();
        List<List<String>> denied = new ArrayList<>(DESTRUCTIVE.subList(0, 5));
        denied.addAll(DESTRUCTIVE.subList(8, 12));
        for (List<String> argv : denied) {
            String commandLine = String.join(" ", argv);
            PolicyRequest request = PolicyRequest.builder("shell").parameter("command", commandLine).build();
            assertThat(engine.evaluate(request).isDenied()).as(commandLine).isTrue();
        }
    }

    private boolean safetyRejects(List<String> argv) {
        try {
            safetyManager.checkCommand(argv.get(0), argv.subList(1, argv.size()));
            return false;
        } catch (CommandRejectedException e) {
            return true;
        }
    }
}
