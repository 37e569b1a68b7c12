package io.github.eutro.lowerj.passes;

import io.github.eutro.lowerj.passes.misc.ChainedPass;

/**
 * A pass over some IR, turning an {@code A} into a {@code B}.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The output.
     */
    B run(A a);

    /**
     * Whether this pass modifies its input and returns it.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, which runs on the result of this one.
     *
     * @param next The next pass.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
