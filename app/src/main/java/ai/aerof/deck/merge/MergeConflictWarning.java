package ai.aerof.deck.merge;

import ai.aerof.deck.tree.Node;
import ai.aerof.deck.tree.TreePath;
import java.util.List;
import java.util.Objects;

/**
 * Informational record of an overlay value replacing a different base value.
 */
public record MergeConflictWarning(List<String> path, Node previous, Node replacement) {

    public MergeConflictWarning {
        path = List.copyOf(Objects.requireNonNull(path, "path"));
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(replacement, "replacement");
    }

    public String describe() {
        return TreePath.format(path) + ": " + summarize(previous) + " -> " + summarize(replacement);
    }

    private static String summarize(Node node) {
        return node.isBlock() ? "<block>" : node.toString();
    }
}
