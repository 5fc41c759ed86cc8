package io.github.eutro.yul2cairo.passes;

import io.github.eutro.yul2cairo.passes.misc.ChainedPass;

/**
 * A pass over some IR, from {@code A} to {@code B}.
 * <p>
 * Passes over Yul never mutate the tree they are given, except to attach
 * {@link io.github.eutro.yul2cairo.ext.Ext exts} to it.
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
     * Whether this pass returns its input, only attaching exts to it.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, feeding the output of this into {@code next}.
     *
     * @param next The pass to run after this one.
     * @param <C>  The output type of the next pass.
     * @return The chained pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
