package ai.aerof.deck.tree;

import ai.aerof.deck.lexer.Lexer;
import java.util.Objects;

/**
 * A keyed child of a {@link Block}. Block values are always keyed by their own name.
 */
public record Entry(String key, Node value) {

    public Entry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (!isValidKey(key)) {
            throw new IllegalArgumentException("Invalid key: '" + key + "'");
        }
        if (value instanceof Block block && !key.equals(block.name())) {
            throw new IllegalArgumentException("Block '" + block.name() + "' cannot be stored under key '" + key + "'");
        }
    }

    public static Entry of(Block block) {
        return new Entry(block.name(), block);
    }

    public static boolean isValidKey(String key) {
        return Lexer.isIdentifier(key) && !Lexer.KEYWORD_UNDER.equals(key);
    }
}
