package io.croissant.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** YAML loading, environment overlay and validation of the command-line configuration. */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    private static String fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI()).toString();
    }

    private static CliConfig load(Map<String, String> env, String... args) {
        return ConfigLoader.load(args, env::get);
    }

    @Nested
    @DisplayName("YAML file")
    class YamlFile {

        @Test
        @DisplayName("All keys are mapped")
        void fullConfig() throws Exception {
            CliConfig config = load(NO_ENV, "validate", "--config", fixture("config/full-config.yaml"));

            assertThat(config.cacheDirectory()).isEqualTo(Path.of("/var/cache/croissant"));
            assertThat(config.httpTimeoutMs()).isEqualTo(15000);
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("Absent keys keep their defaults")
        void partialConfig() throws Exception {
            CliConfig config = load(NO_ENV, "--config", fixture("config/partial-config.yaml"));

            assertThat(config.loggingLevel()).isEqualTo("WARN");
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.httpTimeoutMs()).isEqualTo(60_000);
            assertThat(config.cacheDirectory()).endsWithRaw(Path.of(".cache", "croissant"));
        }

        @Test
        @DisplayName("Empty file means defaults")
        void emptyFile(@TempDir Path dir) throws Exception {
            Path empty = Files.writeString(dir.resolve("empty.yaml"), "");

            CliConfig config = load(NO_ENV, "--config", empty.toString());

            assertThat(config).isEqualTo(CliConfig.builder().build());
        }

        @Test
        @DisplayName("Explicit file that does not exist is an error")
        void missingExplicitFile(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> load(NO_ENV, "--config", missing.toString()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration file not found: " + missing);
        }

        @Test
        @DisplayName("Malformed YAML is an error")
        void malformedYaml(@TempDir Path dir) throws Exception {
            Path broken = Files.writeString(dir.resolve("broken.yaml"), "cache: [unclosed");

            assertThatThrownBy(() -> load(NO_ENV, "--config", broken.toString()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration");
        }

        @Test
        @DisplayName("Non-numeric timeout is an error")
        void nonNumericTimeout(@TempDir Path dir) throws Exception {
            Path config = Files.writeString(dir.resolve("c.yaml"), "http:\n  timeout-ms: soon\n");

            assertThatThrownBy(() -> load(NO_ENV, "--config", config.toString()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("http.timeout-ms must be an integer, got 'soon'");
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvironmentOverlay {

        @Test
        @DisplayName("Variables override the file")
        void variablesWin() throws Exception {
            CliConfig config = load(
                    Map.of(
                            "LOG_LEVEL", "ERROR",
                            "CROISSANT_HTTP_TIMEOUT_MS", " 2500 ",
                            "CROISSANT_CACHE_DIR", "/tmp/c"),
                    "--config",
                    fixture("config/full-config.yaml"));

            assertThat(config.loggingLevel()).isEqualTo("ERROR");
            assertThat(config.httpTimeoutMs()).isEqualTo(2500);
            assertThat(config.cacheDirectory()).isEqualTo(Path.of("/tmp/c"));
            assertThat(config.loggingFormat()).isEqualTo("json");
        }

        @Test
        @DisplayName("Blank variables are ignored")
        void blankVariablesIgnored() throws Exception {
            CliConfig config = load(
                    Map.of("LOG_FORMAT", "  ", "LOG_LEVEL", ""), "--config", fixture("config/full-config.yaml"));

            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("Invalid values are rejected")
        void invalidValues() {
            assertThatThrownBy(() -> load(Map.of("LOG_FORMAT", "xml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("logging.format must be json or text, got xml");
            assertThatThrownBy(() -> load(Map.of("CROISSANT_HTTP_TIMEOUT_MS", "0")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("http.timeout-ms must be positive, got 0");
            assertThatThrownBy(() -> load(Map.of("CROISSANT_HTTP_TIMEOUT_MS", "x")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("CROISSANT_HTTP_TIMEOUT_MS must be an integer, got 'x'");
        }
    }

    @Nested
    @DisplayName("--config argument")
    class ConfigArgument {

        @Test
        void absentMeansNull() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"validate", "--file", "m.json"}))
                    .isNull();
        }

        @Test
        void valueIsResolved() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "x.yaml"}))
                    .isEqualTo(Path.of("x.yaml"));
        }

        @Test
        void missingValueIsRejected() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"load", "--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("--config requires a file path argument");
        }
    }
}
