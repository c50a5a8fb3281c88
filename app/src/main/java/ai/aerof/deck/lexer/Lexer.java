package ai.aerof.deck.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits input deck text into a flat token stream. Whitespace is insignificant and there is no comment syntax.
 */
public final class Lexer {

    public static final String KEYWORD_UNDER = "under";

    public List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text");
        Cursor cursor = new Cursor(text);
        List<Token> tokens = new ArrayList<>();
        while (cursor.hasMore()) {
            char ch = cursor.peek();
            if (Character.isWhitespace(ch)) {
                cursor.advance();
                continue;
            }
            int start = cursor.position;
            int line = cursor.line;
            int column = cursor.column;
            switch (ch) {
                case '{' -> tokens.add(single(cursor, TokenType.LBRACE));
                case '}' -> tokens.add(single(cursor, TokenType.RBRACE));
                case '=' -> tokens.add(single(cursor, TokenType.EQUALS));
                case ';' -> tokens.add(single(cursor, TokenType.SEMICOLON));
                case '"' -> tokens.add(readString(cursor));
                default -> {
                    if (isIdentifierStart(ch)) {
                        String word = readIdentifier(cursor);
                        TokenType type = KEYWORD_UNDER.equals(word) ? TokenType.UNDER : TokenType.IDENTIFIER;
                        tokens.add(new Token(type, word, start, line, column));
                    } else if (startsNumber(text, start)) {
                        int end = scanNumber(text, start);
                        while (cursor.position < end) {
                            cursor.advance();
                        }
                        tokens.add(new Token(TokenType.NUMBER, text.substring(start, end), start, line, column));
                    } else {
                        throw new LexException("Unexpected character '" + ch + "'", start, line, column, ch);
                    }
                }
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Returns whether {@code value} would be lexed as a single identifier (the keyword {@code under} included).
     */
    public static boolean isIdentifier(String value) {
        if (value == null || value.isEmpty() || !isIdentifierStart(value.charAt(0))) {
            return false;
        }
        for (int i = 1; i < value.length(); i++) {
            if (!isIdentifierPart(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isNumber(String value) {
        return value != null && startsNumber(value, 0) && scanNumber(value, 0) == value.length();
    }

    private static Token single(Cursor cursor, TokenType type) {
        Token token = new Token(type, String.valueOf(cursor.peek()), cursor.position, cursor.line, cursor.column);
        cursor.advance();
        return token;
    }

    private static Token readString(Cursor cursor) {
        int start = cursor.position;
        int line = cursor.line;
        int column = cursor.column;
        cursor.advance();
        StringBuilder content = new StringBuilder();
        while (cursor.hasMore() && cursor.peek() != '"') {
            content.append(cursor.peek());
            cursor.advance();
        }
        if (!cursor.hasMore()) {
            throw new LexException("Unterminated string literal", start, line, column, '"');
        }
        cursor.advance();
        return new Token(TokenType.STRING, content.toString(), start, line, column);
    }

    private static String readIdentifier(Cursor cursor) {
        StringBuilder word = new StringBuilder();
        while (cursor.hasMore() && isIdentifierPart(cursor.peek())) {
            word.append(cursor.peek());
            cursor.advance();
        }
        return word.toString();
    }

    private static boolean isIdentifierStart(char ch) {
        return ch == '_' || (ch < 0x80 && Character.isLetter(ch));
    }

    private static boolean isIdentifierPart(char ch) {
        return ch == '_' || ch == '.' || (ch < 0x80 && Character.isLetterOrDigit(ch));
    }

    private static boolean isDigit(String text, int index) {
        return index < text.length() && text.charAt(index) >= '0' && text.charAt(index) <= '9';
    }

    private static boolean startsNumber(String text, int start) {
        int index = start;
        if (index < text.length() && (text.charAt(index) == '+' || text.charAt(index) == '-')) {
            index++;
        }
        if (isDigit(text, index)) {
            return true;
        }
        return index < text.length() && text.charAt(index) == '.' && isDigit(text, index + 1);
    }

    // Caller guarantees startsNumber(text, start).
    private static int scanNumber(String text, int start) {
        int index = start;
        if (text.charAt(index) == '+' || text.charAt(index) == '-') {
            index++;
        }
        while (isDigit(text, index)) {
            index++;
        }
        if (index < text.length() && text.charAt(index) == '.') {
            index++;
            while (isDigit(text, index)) {
                index++;
            }
        }
        if (index < text.length() && (text.charAt(index) == 'e' || text.charAt(index) == 'E')) {
            int exponent = index + 1;
            if (exponent < text.length() && (text.charAt(exponent) == '+' || text.charAt(exponent) == '-')) {
                exponent++;
            }
            if (isDigit(text, exponent)) {
                index = exponent;
                while (isDigit(text, index)) {
                    index++;
                }
            }
        }
        return index;
    }

    private static final class Cursor {

        private final String text;
        private int position;
        private int line = 1;
        private int column = 1;

        private Cursor(String text) {
            this.text = text;
        }

        boolean hasMore() {
            return position < text.length();
        }

        char peek() {
            return text.charAt(position);
        }

        void advance() {
            if (text.charAt(position) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            position++;
        }
    }
}
