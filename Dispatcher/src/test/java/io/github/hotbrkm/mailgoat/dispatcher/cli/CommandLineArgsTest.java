package io.github.hotbrkm.mailgoat.dispatcher.cli;

import io.github.hotbrkm.mailgoat.dispatcher.send.entry.BatchConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CommandLineArgs parsing")
class CommandLineArgsTest {

    private static final Set<String> FLAGS = Set.of("stdin", "continue-on-error");

    @Test
    @DisplayName("Parses positionals, both option spellings and flags")
    void parsesTokens() {
        CommandLineArgs args = CommandLineArgs.parse(new String[]{
                "status", "--csv", "in.csv", "--rate-limit=2.5", "--continue-on-error", "abc"}, FLAGS);

        assertThat(args.positionals()).containsExactly("status", "abc");
        assertThat(args.pathOption("csv")).isEqualTo(Path.of("in.csv"));
        assertThat(args.doubleOption("rate-limit")).isEqualTo(2.5);
        assertThat(args.hasFlag("continue-on-error")).isTrue();
        assertThat(args.hasFlag("stdin")).isFalse();
        assertThat(args.option("json")).isNull();
    }

    @Test
    @DisplayName("Application property tokens are skipped")
    void skipsApplicationProperties() {
        CommandLineArgs args = CommandLineArgs.parse(new String[]{
                "--mailgoat.home=/tmp/x", "--logging.level.root=DEBUG", "--json", "in.json"}, FLAGS);

        assertThat(args.option("json")).isEqualTo("in.json");
        assertThat(args.option("mailgoat.home")).isNull();
    }

    @Test
    @DisplayName("Malformed options are usage errors")
    void usageErrors() {
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[]{"--csv"}, FLAGS))
                .isInstanceOf(CliUsageException.class).hasMessage("option --csv requires a value");
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[]{"--csv", "--stdin"}, FLAGS))
                .isInstanceOf(CliUsageException.class);
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[]{"--stdin=yes"}, FLAGS))
                .isInstanceOf(CliUsageException.class);
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[]{"--csv", "a", "--csv=b"}, FLAGS))
                .hasMessageContaining("more than once");
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[]{"--bogus", "1"}, FLAGS)
                .requireKnown(Set.of("csv"), FLAGS))
                .hasMessage("unknown option --bogus");
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[]{"a", "b"}, FLAGS).requireMaxPositionals(1))
                .hasMessage("unexpected argument: b");
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[0], FLAGS).requireOption("server"))
                .hasMessage("option --server is required");
    }

    @Test
    @DisplayName("Bad option values are configuration errors")
    void configurationErrors() {
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[]{"--rate-limit", "fast"}, FLAGS).doubleOption("rate-limit"))
                .isInstanceOf(BatchConfigurationException.class);
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[]{"--csv= "}, FLAGS).pathOption("csv"))
                .isInstanceOf(BatchConfigurationException.class);
    }
}
