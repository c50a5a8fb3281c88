package ai.aerof.deck.interchange;

import ai.aerof.deck.lexer.Lexer;
import ai.aerof.deck.tree.Block;
import ai.aerof.deck.tree.Entry;
import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.Tree;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts trees to and from plain ordered maps (scalar text or nested map per key).
 *
 * <p>Maps cannot hold duplicate keys, so {@link #toMap(Tree)} keeps the last occurrence at the position of the first.
 * {@link #fromMap(Map)} also accepts keys written as {@code "under Name"} for nested blocks.
 */
public final class TreeMapper {

    private static final String UNDER_PREFIX = Lexer.KEYWORD_UNDER + " ";

    public Map<String, Object> toMap(Tree tree) {
        Objects.requireNonNull(tree, "tree");
        return toMap(tree.root());
    }

    public Tree fromMap(Map<String, ?> map) {
        Objects.requireNonNull(map, "map");
        return new Tree(toBlock(Block.ROOT_NAME, map));
    }

    private Map<String, Object> toMap(Block block) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Entry entry : block.children()) {
            Object value = entry.value() instanceof Block child ? toMap(child) : ((Scalar) entry.value()).text();
            map.put(entry.key(), value);
        }
        return map;
    }

    private Block toBlock(String name, Map<?, ?> map) {
        Block.Builder builder = Block.builder(name);
        for (Map.Entry<?, ?> item : map.entrySet()) {
            if (!(item.getKey() instanceof String rawKey)) {
                throw new IllegalArgumentException("Keys must be strings, got " + item.getKey()
                        + (name.isEmpty() ? "" : " in '" + name + "'"));
            }
            String key = blockKey(rawKey);
            Object value = item.getValue();
            if (value instanceof Map<?, ?> nested) {
                builder.block(toBlock(key, nested));
            } else if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                builder.scalar(key, Scalar.of(String.valueOf(value)));
            } else {
                throw new IllegalArgumentException("Unsupported value for key '" + key + "': "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
            }
        }
        return builder.build();
    }

    static String blockKey(String raw) {
        Objects.requireNonNull(raw, "key");
        String key = raw.trim();
        if (key.startsWith(UNDER_PREFIX)) {
            key = key.substring(UNDER_PREFIX.length()).trim();
        }
        return key;
    }
}
