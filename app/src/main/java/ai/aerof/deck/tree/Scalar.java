package ai.aerof.deck.tree;

import ai.aerof.deck.lexer.Lexer;
import java.util.Objects;

/**
 * Leaf value kept as opaque text together with its lexical style.
 */
public record Scalar(String text, ScalarStyle style) implements Node {

    public Scalar {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(style, "style");
        switch (style) {
            case BARE -> {
                if (!Lexer.isIdentifier(text) || Lexer.KEYWORD_UNDER.equals(text)) {
                    throw new IllegalArgumentException("Bare scalar must be identifier-shaped: " + text);
                }
            }
            case NUMERIC -> {
                if (!Lexer.isNumber(text)) {
                    throw new IllegalArgumentException("Numeric scalar must be a number literal: " + text);
                }
            }
            case QUOTED -> {
                if (text.indexOf('"') >= 0) {
                    throw new IllegalArgumentException("Quoted scalar cannot contain a double quote: " + text);
                }
            }
        }
    }

    /**
     * Creates a scalar whose style is inferred from its text.
     */
    public static Scalar of(String text) {
        Objects.requireNonNull(text, "text");
        if (Lexer.isNumber(text)) {
            return new Scalar(text, ScalarStyle.NUMERIC);
        }
        if (Lexer.isIdentifier(text) && !Lexer.KEYWORD_UNDER.equals(text)) {
            return new Scalar(text, ScalarStyle.BARE);
        }
        return new Scalar(text, ScalarStyle.QUOTED);
    }

    public static Scalar quoted(String text) {
        return new Scalar(text, ScalarStyle.QUOTED);
    }

    @Override
    public String toString() {
        return style == ScalarStyle.QUOTED ? '"' + text + '"' : text;
    }
}
