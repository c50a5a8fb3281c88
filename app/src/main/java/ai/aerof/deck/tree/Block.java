package ai.aerof.deck.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Named, ordered collection of entries. Duplicate keys are kept in the order they were added.
 */
public record Block(String name, List<Entry> children) implements Node {

    public static final String ROOT_NAME = "";

    public Block {
        Objects.requireNonNull(name, "name");
        if (!name.equals(ROOT_NAME) && !Entry.isValidKey(name)) {
            throw new IllegalArgumentException("Invalid block name: '" + name + "'");
        }
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    public static Block empty(String name) {
        return new Block(name, List.of());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Optional<Node> child(String key) {
        int index = indexOf(key);
        return index < 0 ? Optional.empty() : Optional.of(children.get(index).value());
    }

    public int indexOf(String key) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).key().equals(key)) {
                return i;
            }
        }
        return -1;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public Block withChildren(List<Entry> replacement) {
        return new Block(name, replacement);
    }

    /**
     * Mutable assembler used by the parser and by callers building trees programmatically.
     */
    public static final class Builder {

        private final String name;
        private final List<Entry> children = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder scalar(String key, String text) {
            return entry(new Entry(key, Scalar.of(text)));
        }

        public Builder scalar(String key, Scalar scalar) {
            return entry(new Entry(key, scalar));
        }

        public Builder block(Block block) {
            return entry(Entry.of(block));
        }

        public Builder entry(Entry entry) {
            children.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public Block build() {
            return new Block(name, children);
        }
    }
}
