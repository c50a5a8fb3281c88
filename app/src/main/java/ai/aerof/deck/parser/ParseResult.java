package ai.aerof.deck.parser;

import ai.aerof.deck.tree.Tree;
import java.util.List;
import java.util.Objects;

/**
 * Parsed tree together with any warnings raised while recovering from malformed input.
 */
public record ParseResult(Tree tree, List<ParseWarning> warnings) {

    public ParseResult {
        Objects.requireNonNull(tree, "tree");
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
