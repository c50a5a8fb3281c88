package ai.aerof.deck.lexer;

/**
 * Kinds of tokens produced by the {@link Lexer}.
 */
public enum TokenType {
    UNDER,
    IDENTIFIER,
    LBRACE,
    RBRACE,
    EQUALS,
    SEMICOLON,
    STRING,
    NUMBER;

    public boolean isScalar() {
        return this == IDENTIFIER || this == STRING || this == NUMBER;
    }
}
