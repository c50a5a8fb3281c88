package ai.aerof.deck.parser;

import ai.aerof.deck.DeckException;

/**
 * Raised when the token stream does not match the input deck grammar.
 */
public class ParseException extends DeckException {

    private final String expected;
    private final String found;
    private final int position;
    private final int line;
    private final int column;

    public ParseException(String expected, String found, int position, int line, int column) {
        super(String.format("Expected %s but found %s at line %d, column %d (offset %d)",
                expected, found, line, column, position));
        this.expected = expected;
        this.found = found;
        this.position = position;
        this.line = line;
        this.column = column;
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
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
}
