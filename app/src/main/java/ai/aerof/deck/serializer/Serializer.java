package ai.aerof.deck.serializer;

import ai.aerof.deck.lexer.Lexer;
import ai.aerof.deck.tree.Block;
import ai.aerof.deck.tree.Entry;
import ai.aerof.deck.tree.Node;
import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.Tree;
import java.util.Objects;

/**
 * Renders a {@link Tree} in canonical input deck form, one statement per line, children in tree order.
 */
public class Serializer {

    public static final int DEFAULT_INDENT_WIDTH = 2;
    public static final int MAX_INDENT_WIDTH = 8;

    private final String indentUnit;

    public Serializer() {
        this(DEFAULT_INDENT_WIDTH);
    }

    public Serializer(int indentWidth) {
        if (indentWidth < 1 || indentWidth > MAX_INDENT_WIDTH) {
            throw new IllegalArgumentException("indentWidth must be between 1 and " + MAX_INDENT_WIDTH);
        }
        this.indentUnit = " ".repeat(indentWidth);
    }

    public String serialize(Tree tree) {
        Objects.requireNonNull(tree, "tree");
        StringBuilder out = new StringBuilder();
        writeChildren(out, tree.root(), 0);
        return out.toString();
    }

    /**
     * Renders a single node as it would appear at the top level under {@code key}.
     */
    public String serialize(String key, Node node) {
        StringBuilder out = new StringBuilder();
        writeEntry(out, new Entry(key, node), 0);
        return out.toString();
    }

    private void writeChildren(StringBuilder out, Block block, int depth) {
        for (Entry entry : block.children()) {
            writeEntry(out, entry, depth);
        }
    }

    private void writeEntry(StringBuilder out, Entry entry, int depth) {
        String indent = indentUnit.repeat(depth);
        if (entry.value() instanceof Block block) {
            out.append(indent).append(Lexer.KEYWORD_UNDER).append(' ').append(block.name()).append(" {\n");
            writeChildren(out, block, depth + 1);
            out.append(indent).append("}\n");
        } else if (entry.value() instanceof Scalar scalar) {
            out.append(indent).append(entry.key()).append(" = ").append(scalar).append(";\n");
        } else {
            throw new IllegalArgumentException("Unsupported node type: " + entry.value().getClass().getName());
        }
    }
}
