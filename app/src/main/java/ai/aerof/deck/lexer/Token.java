package ai.aerof.deck.lexer;

import java.util.Objects;

/**
 * A lexeme with its source location. For {@link TokenType#STRING} the text excludes the quotes.
 */
public record Token(TokenType type, String text, int position, int line, int column) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        if (position < 0 || line < 1 || column < 1) {
            throw new IllegalArgumentException("Invalid token location");
        }
    }

    /**
     * Number of source characters the token covers, including the quotes of a string.
     */
    public int width() {
        return type == TokenType.STRING ? text.length() + 2 : text.length();
    }

    public int endPosition() {
        return position + width();
    }

    /**
     * Line of the first character after the token. Only strings can span lines.
     */
    public int endLine() {
        int newlines = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                newlines++;
            }
        }
        return line + newlines;
    }

    public int endColumn() {
        int lastNewline = text.lastIndexOf('\n');
        if (lastNewline < 0) {
            return column + width();
        }
        // remaining content plus the closing quote
        return text.length() - lastNewline + 1;
    }

    public String describe() {
        return switch (type) {
            case STRING -> "string \"" + text + "\"";
            case NUMBER -> "number " + text;
            case IDENTIFIER -> "identifier '" + text + "'";
            default -> "'" + text + "'";
        };
    }
}
