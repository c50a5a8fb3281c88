package ai.aerof.deck.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable parsed input deck rooted at an implicit, unnamed block.
 *
 * <p>Path lookups follow the first entry whose key matches at each level. {@link #set(List, Node)} returns a new
 * tree and shares every subtree it does not touch with the original.
 */
public record Tree(Block root) {

    public Tree {
        Objects.requireNonNull(root, "root");
        if (!Block.ROOT_NAME.equals(root.name())) {
            throw new IllegalArgumentException("Tree root must be unnamed, got '" + root.name() + "'");
        }
    }

    public static Tree empty() {
        return new Tree(Block.empty(Block.ROOT_NAME));
    }

    public static Tree of(List<Entry> entries) {
        return new Tree(new Block(Block.ROOT_NAME, entries));
    }

    public static Block.Builder builder() {
        return Block.builder(Block.ROOT_NAME);
    }

    public List<Entry> entries() {
        return root.children();
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    public Optional<Node> get(String... path) {
        return get(List.of(path));
    }

    public Optional<Node> get(List<String> path) {
        Objects.requireNonNull(path, "path");
        Node current = root;
        for (String segment : path) {
            if (!(current instanceof Block block)) {
                return Optional.empty();
            }
            Optional<Node> next = block.child(segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    public Optional<Scalar> scalar(String... path) {
        return get(path).filter(Scalar.class::isInstance).map(Scalar.class::cast);
    }

    public Tree set(List<String> path, Node value) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(value, "value");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must contain at least one segment");
        }
        return new Tree(setIn(root, path, 0, value));
    }

    private static Block setIn(Block block, List<String> path, int depth, Node value) {
        String key = path.get(depth);
        boolean leaf = depth == path.size() - 1;
        int index = block.indexOf(key);

        Entry replacement;
        if (leaf) {
            replacement = new Entry(key, value instanceof Block child ? rename(child, key) : value);
        } else {
            Block next = index >= 0 && block.children().get(index).value() instanceof Block existing
                    ? existing
                    : Block.empty(key);
            replacement = Entry.of(setIn(next, path, depth + 1, value));
        }

        List<Entry> children = new ArrayList<>(block.children());
        if (index >= 0) {
            children.set(index, replacement);
        } else {
            children.add(replacement);
        }
        return block.withChildren(children);
    }

    private static Block rename(Block block, String name) {
        return block.name().equals(name) ? block : new Block(name, block.children());
    }
}
