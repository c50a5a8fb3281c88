package ai.aerof.deck.tree;

/**
 * How a scalar was written in the source and therefore how it is rendered back.
 */
public enum ScalarStyle {
    BARE,
    NUMERIC,
    QUOTED
}
