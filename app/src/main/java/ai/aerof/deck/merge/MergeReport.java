package ai.aerof.deck.merge;

import ai.aerof.deck.tree.Tree;
import java.util.List;
import java.util.Objects;

/**
 * Merged tree plus the base values that were overwritten on the way.
 */
public record MergeReport(Tree tree, List<MergeConflictWarning> warnings) {

    public MergeReport {
        Objects.requireNonNull(tree, "tree");
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    }
}
