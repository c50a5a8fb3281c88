package ai.aerof.deck.parser;

import java.util.Objects;

/**
 * Recoverable problem reported by a permissive parse.
 */
public record ParseWarning(String message, int line, int column) {

    public ParseWarning {
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return message + " (line " + line + ", column " + column + ")";
    }
}
