package ai.aerof.deck.cli;

import ai.aerof.deck.config.LogFormat;
import ai.aerof.deck.config.OutputFormat;
import ai.aerof.deck.parser.ParsePolicy;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "aerof-deck", mixinStandardHelpOptions = true,
        description = "Parses, merges and re-renders AERO-F input decks")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "BASE",
            description = "Base input deck (.json files are read as JSON); starts from an empty deck when omitted")
    private Path basePath;

    @CommandLine.Option(names = "--overlay", paramLabel = "FILE", description = "Deck or JSON file merged over the base, in order")
    private List<Path> overlayPaths = new ArrayList<>();

    @CommandLine.Option(names = "--set", paramLabel = "PATH=VALUE", description = "Parameter override, e.g. Input/Geometry=wing.msh")
    private List<String> assignments = new ArrayList<>();

    @CommandLine.Option(names = "--prompt", paramLabel = "TEXT", description = "Simulation request to infer parameters from")
    private String prompt;

    @CommandLine.Option(names = "--get", paramLabel = "PATH", description = "Print the value at PATH instead of the whole deck")
    private String query;

    @CommandLine.Option(names = "--output", paramLabel = "FILE", description = "Write the result to FILE instead of standard output")
    private Path outputPath;

    @CommandLine.Option(names = "--output-format", converter = OutputFormatConverter.class, description = "Output format: deck or json")
    private OutputFormat outputFormat;

    @CommandLine.Option(names = "--policy", converter = ParsePolicyConverter.class, description = "Parse policy: strict or permissive")
    private ParsePolicy parsePolicy;

    @CommandLine.Option(names = "--indent", paramLabel = "COLUMNS", description = "Indentation width of the rendered deck")
    private Integer indentWidth;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class, description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public Path basePath() {
        return basePath;
    }

    public List<Path> overlayPaths() {
        return overlayPaths == null ? List.of() : overlayPaths;
    }

    public List<String> assignments() {
        return assignments == null ? List.of() : assignments;
    }

    public String prompt() {
        return prompt;
    }

    public String query() {
        return query;
    }

    public Path outputPath() {
        return outputPath;
    }

    public OutputFormat outputFormat() {
        return outputFormat;
    }

    public ParsePolicy parsePolicy() {
        return parsePolicy;
    }

    public Integer indentWidth() {
        return indentWidth;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
