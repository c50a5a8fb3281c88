package ai.aerof.deck.parser;

/**
 * How the parser reacts to truncated or malformed input.
 */
public enum ParsePolicy {
    /** Unterminated blocks and malformed statements are errors. */
    STRICT,
    /** Blocks open at end of input are closed and malformed statements are skipped with a warning. */
    PERMISSIVE;

    public static ParsePolicy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return STRICT;
        }
        for (ParsePolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(raw.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unsupported parse policy: " + raw);
    }
}
