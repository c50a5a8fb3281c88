package ai.aerof.deck.inference;

import ai.aerof.deck.tree.Tree;
import java.util.Map;
import java.util.Objects;

/**
 * Partial tree inferred from a free-text request, with the recognised facts by name.
 */
public record InferredParameters(Tree overlay, Map<String, String> facts) {

    public InferredParameters {
        Objects.requireNonNull(overlay, "overlay");
        facts = Map.copyOf(Objects.requireNonNull(facts, "facts"));
    }

    public boolean isEmpty() {
        return overlay.isEmpty();
    }
}
