package ai.aerof.deck.config;

import ai.aerof.deck.cli.CliArguments;
import ai.aerof.deck.parser.ParsePolicy;
import ai.aerof.deck.serializer.Serializer;
import ai.aerof.deck.tree.TreePath;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_PARSE_POLICY = "DECK_PARSE_POLICY";
    static final String ENV_INDENT_WIDTH = "DECK_INDENT_WIDTH";
    static final String ENV_OUTPUT_FORMAT = "DECK_OUTPUT_FORMAT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        List<ParameterAssignment> assignments = arguments.assignments().stream()
                .map(ParameterAssignment::parse)
                .collect(Collectors.toList());
        Optional<List<String>> query = Optional.ofNullable(arguments.query())
                .filter(ConfigLoader::isNotBlank)
                .map(TreePath::parse);

        return new Config(
                Optional.ofNullable(arguments.basePath()),
                arguments.overlayPaths(),
                assignments,
                Optional.ofNullable(arguments.prompt()),
                query,
                Optional.ofNullable(arguments.outputPath()),
                resolveOutputFormat(arguments),
                resolveParsePolicy(arguments),
                resolveIndentWidth(arguments),
                resolveLogFormat(arguments),
                arguments.verbose());
    }

    private ParsePolicy resolveParsePolicy(CliArguments arguments) {
        ParsePolicy cliPolicy = arguments.parsePolicy();
        if (cliPolicy != null) {
            return cliPolicy;
        }
        return environmentReader.get(ENV_PARSE_POLICY)
                .filter(ConfigLoader::isNotBlank)
                .map(ParsePolicy::from)
                .orElse(ParsePolicy.STRICT);
    }

    private OutputFormat resolveOutputFormat(CliArguments arguments) {
        OutputFormat cliFormat = arguments.outputFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_OUTPUT_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(OutputFormat::from)
                .orElse(OutputFormat.DECK);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveIndentWidth(CliArguments arguments) {
        Integer cliWidth = arguments.indentWidth();
        if (cliWidth != null) {
            return cliWidth;
        }
        return environmentReader.get(ENV_INDENT_WIDTH)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseIndentWidth)
                .orElse(Serializer.DEFAULT_INDENT_WIDTH);
    }

    private static int parseIndentWidth(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_INDENT_WIDTH + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
