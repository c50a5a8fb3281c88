package ai.aerof.deck;

/**
 * Runtime exception raised when an input deck cannot be read.
 */
public class DeckException extends RuntimeException {

    public DeckException(String message) {
        super(message);
    }

    public DeckException(String message, Throwable cause) {
        super(message, cause);
    }
}
