package ai.aerof.deck.tree;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Slash-separated path notation ({@code Time/Implicit/Order}). Dots belong to keys, so they are not separators.
 */
public final class TreePath {

    public static final String SEPARATOR = "/";

    private TreePath() {
    }

    public static List<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Path must not be blank");
        }
        List<String> segments = Arrays.stream(raw.trim().split(SEPARATOR))
                .map(String::trim)
                .filter(segment -> !segment.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        for (String segment : segments) {
            if (!Entry.isValidKey(segment)) {
                throw new IllegalArgumentException("Invalid path segment '" + segment + "' in " + raw);
            }
        }
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Path must contain at least one segment: " + raw);
        }
        return segments;
    }

    public static String format(List<String> path) {
        return String.join(SEPARATOR, path);
    }
}
