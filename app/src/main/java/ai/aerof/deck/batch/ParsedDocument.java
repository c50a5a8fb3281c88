package ai.aerof.deck.batch;

import ai.aerof.deck.parser.ParseWarning;
import ai.aerof.deck.tree.Tree;
import java.util.List;
import java.util.Objects;

public record ParsedDocument(String name, Tree tree, List<ParseWarning> warnings) {

    public ParsedDocument {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tree, "tree");
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    }
}
