package ai.aerof.deck.batch;

import java.util.Objects;

public record DocumentFailure(String name, String message) {

    public DocumentFailure {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(message, "message");
    }
}
