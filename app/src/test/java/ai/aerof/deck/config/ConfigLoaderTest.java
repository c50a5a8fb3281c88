package ai.aerof.deck.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.aerof.deck.cli.CliArguments;
import ai.aerof.deck.parser.ParsePolicy;
import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.ScalarStyle;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "base.deck",
                "--overlay", "tuning.deck",
                "--overlay", "inlet.json",
                "--set", "Input/Geometry=wing.msh",
                "--set", "Output/Prefix=\"results/run 1\"",
                "--prompt", "steady run",
                "--get", "Time/Implicit/Order",
                "--output", "out/input.deck",
                "--output-format", "json",
                "--policy", "permissive",
                "--indent", "4",
                "--log-format", "json",
                "--verbose");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.basePath()).contains(Path.of("base.deck"));
        assertThat(config.overlayPaths()).containsExactly(Path.of("tuning.deck"), Path.of("inlet.json"));
        assertThat(config.assignments()).containsExactly(
                new ParameterAssignment(List.of("Input", "Geometry"), new Scalar("wing.msh", ScalarStyle.BARE)),
                new ParameterAssignment(List.of("Output", "Prefix"), Scalar.quoted("results/run 1")));
        assertThat(config.prompt()).contains("steady run");
        assertThat(config.query()).contains(List.of("Time", "Implicit", "Order"));
        assertThat(config.outputPath()).contains(Path.of("out/input.deck"));
        assertThat(config.outputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.parsePolicy()).isEqualTo(ParsePolicy.PERMISSIVE);
        assertThat(config.indentWidth()).isEqualTo(4);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isTrue();
    }

    @Test
    void usesDefaultsWhenNothingIsConfigured() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of());
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.basePath()).isEmpty();
        assertThat(config.overlayPaths()).isEmpty();
        assertThat(config.assignments()).isEmpty();
        assertThat(config.query()).isEmpty();
        assertThat(config.outputFormat()).isEqualTo(OutputFormat.DECK);
        assertThat(config.parsePolicy()).isEqualTo(ParsePolicy.STRICT);
        assertThat(config.indentWidth()).isEqualTo(2);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.verbose()).isFalse();
        assertThat(environmentReader.requestedKeys()).containsExactlyInAnyOrder(
                ConfigLoader.ENV_PARSE_POLICY,
                ConfigLoader.ENV_INDENT_WIDTH,
                ConfigLoader.ENV_OUTPUT_FORMAT,
                ConfigLoader.ENV_LOG_FORMAT);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_PARSE_POLICY, "Permissive");
        envValues.put(ConfigLoader.ENV_INDENT_WIDTH, " 3 ");
        envValues.put(ConfigLoader.ENV_OUTPUT_FORMAT, "json");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");

        Config config = new ConfigLoader(new RecordingEnvironmentReader(envValues))
                .load(CommandLine.populateCommand(new CliArguments()));

        assertThat(config.parsePolicy()).isEqualTo(ParsePolicy.PERMISSIVE);
        assertThat(config.indentWidth()).isEqualTo(3);
        assertThat(config.outputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void cliValuesTakePrecedenceOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_PARSE_POLICY, "permissive",
                ConfigLoader.ENV_INDENT_WIDTH, "6"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--policy", "strict", "--indent", "1");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.parsePolicy()).isEqualTo(ParsePolicy.STRICT);
        assertThat(config.indentWidth()).isEqualTo(1);
        assertThat(environmentReader.requestedKeys()).doesNotContain(ConfigLoader.ENV_PARSE_POLICY, ConfigLoader.ENV_INDENT_WIDTH);
    }

    @Test
    void nonNumericIndentWidthIsRejected() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_INDENT_WIDTH, "wide"));

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader)
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_INDENT_WIDTH);
    }

    @Test
    void outOfRangeIndentWidthIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--indent", "12");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 8");
    }

    @Test
    void malformedAssignmentIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--set", "Input/Geometry");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("PATH=VALUE");
    }

    @Test
    void unknownPolicyInEnvironmentIsRejected() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_PARSE_POLICY, "lenient"));

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader)
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
