package ai.aerof.deck.batch;

import java.util.Objects;

/**
 * Raw deck text with a name used in logs and failure reports.
 */
public record SourceDocument(String name, String text) {

    public SourceDocument {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(text, "text");
    }
}
