package io.aegis.core.guard;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class OutputInspectorTest {

    @Test
    void shouldRequireEveryFragmentOfASignature() {
        OutputInspector inspector = OutputInspector.safetyDefaults();

        assertThat(inspector.inspect("cat: secret: Permission denied")).isEmpty();
        assertThat(inspector.inspect("root: Permission denied"))
            .map(OutputInspector.Signature::describe)
            .contains("Permission denied + root");
    }

    @Test
    void shouldFlagMissingFilesOnlyInSandboxSignatures() {
        String output = "ls: cannot access 'x': No such file or directory";

        assertThat(OutputInspector.sandboxDefaults().inspect(output)).isPresent();
        assertThat(OutputInspector.safetyDefaults().inspect(output)).isEmpty();
    }
}
