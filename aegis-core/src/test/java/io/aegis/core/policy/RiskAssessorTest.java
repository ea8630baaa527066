package io.aegis.core.policy;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class RiskAssessorTest {

    @Test
    void shouldRateWritesToSystemPathsCritical() {
        assertThat(RiskAssessor.assess("file_write", Map.of("path", "/sys/kernel/x"))).isEqualTo(RiskLevel.CRITICAL);
        assertThat(RiskAssessor.assess("file_write", Map.of("path", "/tmp/x"))).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void shouldRateReadOnlyToolsLow() {
        assertThat(RiskAssessor.assess("file_read", Map.of())).isEqualTo(RiskLevel.LOW);
        assertThat(RiskAssessor.assess("directory_list", null)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskAssessor.assess("process_list", Map.of())).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void shouldDefaultToMedium() {
        assertThat(RiskAssessor.assess("shell", Map.of("command", "ls"))).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskAssessor.assess(null, null)).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void shouldParseLabelsCaseInsensitively() {
        assertThat(RiskLevel.fromLabel(" High ")).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.CRITICAL.label()).isEqualTo("critical");
    }
}
