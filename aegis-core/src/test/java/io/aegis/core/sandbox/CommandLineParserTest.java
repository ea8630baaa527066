package io.aegis.core.sandbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.aegis.core.guard.CommandRejectedException;
import io.aegis.core.guard.ErrorKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class CommandLineParserTest {

    @Test
    void shouldSplitOnWhitespace() throws Exception {
        ParsedCommand parsed = CommandLineParser.parse("  systemctl   status ssh ");

        assertThat(parsed.program()).isEqualTo("systemctl");
        assertThat(parsed.args()).containsExactly("status", "ssh");
        assertThat(parsed.argv()).containsExactly("systemctl", "status", "ssh");
    }

    @Test
    void shouldGroupQuotedWords() throws Exception {
        ParsedCommand parsed = CommandLineParser.parse("grep \"two words\" 'file name.txt' ''");

        assertThat(parsed.program()).isEqualTo("grep");
        assertThat(parsed.args()).containsExactly("two words", "file name.txt", "");
    }

    @Test
    void shouldRejectShellMetacharacters() {
        for (String raw : List.of("ls | grep foo", "echo $HOME", "cat ~/x", "ls; rm x", "echo `id`", "ls *.txt", "cat < in")) {
            assertThatThrownBy(() -> CommandLineParser.parse(raw))
                .as(raw)
                .isInstanceOfSatisfying(CommandRejectedException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.SHELL_METACHARACTER);
                    assertThat(e.reason()).isEqualTo("Command contains shell metacharacters and must be executed through shell");
                });
        }
    }

    @Test
    void shouldRejectMetacharactersEvenInsideQuotes() {
        assertThatThrownBy(() -> CommandLineParser.parse("echo 'a|b'"))
            .isInstanceOfSatisfying(CommandRejectedException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.SHELL_METACHARACTER));
    }

    @Test
    void shouldRejectBlankInput() {
        for (String raw : new String[] {null, "", "   "}) {
            assertThatThrownBy(() -> CommandLineParser.parse(raw))
                .isInstanceOfSatisfying(CommandRejectedException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.EMPTY_COMMAND));
        }
    }
}
