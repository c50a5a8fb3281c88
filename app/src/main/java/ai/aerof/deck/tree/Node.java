package ai.aerof.deck.tree;

/**
 * A value in an input deck tree: either a {@link Block} or a {@link Scalar}.
 */
public interface Node {

    default boolean isBlock() {
        return this instanceof Block;
    }

    default boolean isScalar() {
        return this instanceof Scalar;
    }
}
