package ai.aerof.deck.lexer;

import ai.aerof.deck.DeckException;

/**
 * Raised when the input contains a character that cannot start or continue a token.
 */
public class LexException extends DeckException {

    private final int position;
    private final int line;
    private final int column;
    private final char unexpectedChar;

    public LexException(String message, int position, int line, int column, char unexpectedChar) {
        super(String.format("%s at line %d, column %d (offset %d)", message, line, column, position));
        this.position = position;
        this.line = line;
        this.column = column;
        this.unexpectedChar = unexpectedChar;
    }

    public int position() {
        return position;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public char unexpectedChar() {
        return unexpectedChar;
    }
}
