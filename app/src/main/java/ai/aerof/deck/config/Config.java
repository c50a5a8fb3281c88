package ai.aerof.deck.config;

import ai.aerof.deck.parser.ParsePolicy;
import ai.aerof.deck.serializer.Serializer;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Optional<Path> basePath,
        List<Path> overlayPaths,
        List<ParameterAssignment> assignments,
        Optional<String> prompt,
        Optional<List<String>> query,
        Optional<Path> outputPath,
        OutputFormat outputFormat,
        ParsePolicy parsePolicy,
        int indentWidth,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        basePath = basePath == null ? Optional.empty() : basePath;
        overlayPaths = overlayPaths == null ? List.of() : List.copyOf(overlayPaths);
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        prompt = prompt == null ? Optional.empty() : prompt.filter(value -> !value.isBlank());
        query = query == null ? Optional.empty() : query.map(List::copyOf);
        outputPath = outputPath == null ? Optional.empty() : outputPath;
        outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
        parsePolicy = Objects.requireNonNull(parsePolicy, "parsePolicy");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        if (indentWidth < 1 || indentWidth > Serializer.MAX_INDENT_WIDTH) {
            throw new IllegalArgumentException("indentWidth must be between 1 and " + Serializer.MAX_INDENT_WIDTH);
        }
    }
}
