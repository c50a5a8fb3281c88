package ai.aerof.deck.config;

import java.util.Locale;

/**
 * Rendering used for the merged result: canonical deck text or JSON.
 */
public enum OutputFormat {
    DECK,
    JSON;

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return DECK;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "deck", "text" -> DECK;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unsupported output format: " + raw);
        };
    }
}
