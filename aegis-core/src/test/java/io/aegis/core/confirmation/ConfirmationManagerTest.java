package io.aegis.core.confirmation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ConfirmationManagerTest {

    private final ConfirmationManager manager = new ConfirmationManager();

    @Test
    void shouldFlagDestructiveVerbsCaseInsensitively() {
        assertThat(manager.requiresConfirmation("DELETE user", "/home/me/file.txt")).isTrue();
        assertThat(manager.requiresConfirmation("apt-get update", "")).isTrue();
        assertThat(manager.requiresConfirmation("read", "/home/me/file.txt")).isFalse();
    }

    @Test
    void shouldFlagSystemDirectoriesAndSensitiveFiles() {
        assertThat(manager.requiresConfirmation("read", "/etc/hosts")).isTrue();
        assertThat(manager.requiresConfirmation("read", "/home/me/server.PEM")).isTrue();
        assertThat(manager.requiresConfirmation("read", "/home/me/app.config")).isTrue();
        assertThat(manager.requiresConfirmation("read", "/etc")).isFalse();
    }

    @Test
    void shouldNeverRequireConfirmationWhenDisabled() {
        manager.setRequireConfirmation(false);

        assertThat(manager.isRequireConfirmation()).isFalse();
        assertThat(manager.requiresConfirmation("rm", "/etc/passwd")).isFalse();

        manager.setRequireConfirmation(true);
        assertThat(manager.requiresConfirmation("rm", "/etc/passwd")).isTrue();
    }

    @Test
    void shouldBuildPromptNamingOperationAndTarget() {
        String prompt = manager.getConfirmationPrompt("rm -rf build", "build");

        assertThat(prompt).startsWith("WARNING: This operation may be destructive!\n\n");
        assertThat(prompt).contains("Operation: rm -rf build\n", "Target: build\n");
        assertThat(prompt).endsWith("(type 'yes' to confirm): ");
    }

    @Test
    void shouldAcceptOnlyYes() {
        assertThat(manager.validateConfirmation("yes")).isTrue();
        assertThat(manager.validateConfirmation("  YES \n")).isTrue();
        assertThat(manager.validateConfirmation("y")).isFalse();
        assertThat(manager.validateConfirmation("yes please")).isFalse();
        assertThat(manager.validateConfirmation(null)).isFalse();
    }

    @Test
    void shouldAnswerWithFixedPort() {
        ConfirmationPort port = ConfirmationPort.answering("yes");

        assertThat(manager.validateConfirmation(port.requestConfirmation("anything"))).isTrue();
    }
}
