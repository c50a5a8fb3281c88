package ai.aerof.deck.merge;

import ai.aerof.deck.tree.Block;
import ai.aerof.deck.tree.Entry;
import ai.aerof.deck.tree.Node;
import ai.aerof.deck.tree.Scalar;
import ai.aerof.deck.tree.Tree;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Overlays one tree onto another. The overlay wins on every key it names; keys only present in the base keep their
 * value and position, and keys new to the base are appended in overlay order.
 *
 * <p>Every key the overlay names ends up exactly once in its block: later base duplicates are folded into the first
 * occurrence (blocks) or dropped (scalars). Inputs are never modified. Re-applying an overlay to its own merge
 * result yields the same tree.
 */
public class MergeEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(MergeEngine.class);

    public Tree merge(Tree base, Tree overlay) {
        return mergeWithReport(base, overlay).tree();
    }

    public MergeReport mergeWithReport(Tree base, Tree overlay) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(overlay, "overlay");
        List<MergeConflictWarning> warnings = new ArrayList<>();
        Block merged = mergeBlock(base.root(), overlay.root(), List.of(), warnings);
        for (MergeConflictWarning warning : warnings) {
            LOGGER.debug("Overlay replaced {}", warning.describe());
        }
        return new MergeReport(new Tree(merged), warnings);
    }

    private Block mergeBlock(Block base, Block overlay, List<String> path, List<MergeConflictWarning> warnings) {
        List<Entry> children = new ArrayList<>(base.children());
        for (Entry incoming : overlay.children()) {
            String key = incoming.key();
            List<String> childPath = append(path, key);
            int index = indexOf(children, key);
            Node value = incoming.value();

            if (index < 0) {
                children.add(value instanceof Block block
                        ? Entry.of(mergeBlock(Block.empty(key), block, childPath, warnings))
                        : incoming);
                continue;
            }

            Node existing = children.get(index).value();
            if (value instanceof Block block && existing instanceof Block current) {
                Block folded = foldLaterDuplicates(children, index, childPath, current, warnings);
                children.set(index, Entry.of(mergeBlock(folded, block, childPath, warnings)));
            } else if (value instanceof Scalar) {
                noteReplacement(warnings, childPath, existing, value);
                children.set(index, incoming);
                dropLaterDuplicates(children, index, childPath, value, warnings);
            } else {
                Block replacement = mergeBlock(Block.empty(key), (Block) value, childPath, warnings);
                noteReplacement(warnings, childPath, existing, replacement);
                children.set(index, Entry.of(replacement));
                dropLaterDuplicates(children, index, childPath, replacement, warnings);
            }
        }
        return base.withChildren(children);
    }

    // Later same-named blocks are merged into the first one in document order; later scalars are dropped.
    private Block foldLaterDuplicates(List<Entry> children, int index, List<String> path, Block first,
                                      List<MergeConflictWarning> warnings) {
        Block folded = first;
        int i = index + 1;
        while (i < children.size()) {
            Entry later = children.get(i);
            if (!later.key().equals(first.name())) {
                i++;
                continue;
            }
            if (later.value() instanceof Block block) {
                folded = mergeBlock(folded, block, path, warnings);
            } else {
                noteReplacement(warnings, path, later.value(), folded);
            }
            children.remove(i);
        }
        return folded;
    }

    private static void dropLaterDuplicates(List<Entry> children, int index, List<String> path, Node winner,
                                            List<MergeConflictWarning> warnings) {
        String key = children.get(index).key();
        for (int i = children.size() - 1; i > index; i--) {
            if (children.get(i).key().equals(key)) {
                noteReplacement(warnings, path, children.get(i).value(), winner);
                children.remove(i);
            }
        }
    }

    private static void noteReplacement(List<MergeConflictWarning> warnings, List<String> path, Node previous, Node replacement) {
        if (!previous.equals(replacement)) {
            warnings.add(new MergeConflictWarning(path, previous, replacement));
        }
    }

    private static int indexOf(List<Entry> children, String key) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).key().equals(key)) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> append(List<String> path, String key) {
        List<String> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(key);
        return List.copyOf(extended);
    }
}
