package io.croissant.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class CliArgumentsTest {

    @Test
    void parsesValidate() {
        CliArguments arguments = CliArguments.parse(new String[] {"validate", "--file", "metadata.json"});

        assertThat(arguments.command()).isEqualTo(CliArguments.Command.VALIDATE);
        assertThat(arguments.file()).isEqualTo(Path.of("metadata.json"));
        assertThat(arguments.recordSet()).isNull();
        assertThat(arguments.numRecords()).isEqualTo(-1);
        assertThat(arguments.debug()).isFalse();
    }

    @Test
    void parsesLoadWithEveryOption() {
        CliArguments arguments = CliArguments.parse(new String[] {
            "load", "--config", "c.yaml", "--file", "m.json", "--record-set", "passengers", "--num-records", "10",
            "--debug"
        });

        assertThat(arguments.command()).isEqualTo(CliArguments.Command.LOAD);
        assertThat(arguments.recordSet()).isEqualTo("passengers");
        assertThat(arguments.numRecords()).isEqualTo(10);
        assertThat(arguments.debug()).isTrue();
    }

    @Test
    void rejectsIncompleteCommandLines() {
        assertThatThrownBy(() -> CliArguments.parse(new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Missing command.");
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"convert"}))
                .hasMessageStartingWith("Unknown command 'convert'.");
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"validate"}))
                .hasMessageStartingWith("--file is required.");
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"load", "--file", "m.json"}))
                .hasMessageStartingWith("--record-set is required for load.");
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"validate", "--file"}))
                .hasMessageStartingWith("--file requires a value.");
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"validate", "--file", "m.json", "--verbose"}))
                .hasMessageStartingWith("Unknown option '--verbose'.");
    }

    @Test
    void rejectsInvalidRecordCounts() {
        assertThatThrownBy(() -> CliArguments.parse(
                        new String[] {"load", "--file", "m.json", "--record-set", "rs", "--num-records", "-2"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--num-records must be -1 or a non-negative number, got -2");
        assertThatThrownBy(() -> CliArguments.parse(
                        new String[] {"load", "--file", "m.json", "--record-set", "rs", "--num-records", "many"}))
                .hasMessage("--num-records must be a number, got 'many'");
    }
}
