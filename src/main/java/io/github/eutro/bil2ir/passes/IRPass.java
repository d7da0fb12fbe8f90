package io.github.eutro.bil2ir.passes;

import io.github.eutro.bil2ir.passes.misc.ChainedPass;

/**
 * A single stage of the pipeline from lifted expressions to analysis IR.
 *
 * @param <A> The type of IR this pass consumes.
 * @param <B> The type of IR this pass produces.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input IR.
     * @return The output IR.
     */
    B run(A a);

    /**
     * Whether this pass returns its input, rather than building new IR.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, which is run on the result of this one.
     *
     * @param next The pass to run after this one.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
