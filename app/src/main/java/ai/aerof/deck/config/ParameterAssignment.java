package ai.aerof.deck.config;

import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.TreePath;
import java.util.List;
import java.util.Objects;

/**
 * A {@code PATH=VALUE} override given on the command line, e.g. {@code Input/Geometry=wing.msh}.
 */
public record ParameterAssignment(List<String> path, Scalar value) {

    public ParameterAssignment {
        path = List.copyOf(Objects.requireNonNull(path, "path"));
        Objects.requireNonNull(value, "value");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Assignment path must not be empty");
        }
    }

    public static ParameterAssignment parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Assignment must not be null");
        }
        int separator = raw.indexOf('=');
        if (separator <= 0) {
            throw new IllegalArgumentException("Assignment must have the form PATH=VALUE: " + raw);
        }
        String value = raw.substring(separator + 1).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Assignment value must not be empty: " + raw);
        }
        List<String> path = TreePath.parse(raw.substring(0, separator));
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return new ParameterAssignment(path, Scalar.quoted(value.substring(1, value.length() - 1)));
        }
        return new ParameterAssignment(path, Scalar.of(value));
    }
}
