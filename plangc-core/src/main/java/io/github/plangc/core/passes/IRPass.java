package io.github.plangc.core.passes;

import io.github.plangc.core.passes.misc.ChainedPass;

/**
 * One step of the compiler middle-end: a transformation from one form of a policy
 * program to another, such as {@code ProgramNode -> Module}, or a rewrite or analysis
 * of a {@link io.github.plangc.core.ir.Module} or {@link io.github.plangc.core.ir.Function}.
 * <p>
 * Pass instances are shared, usually as an {@code INSTANCE} constant, and may run over
 * several modules at once. Anything a run computes is attached to the IR as an
 * {@link io.github.plangc.core.ext.Ext ext}, never kept in the pass.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 * @see InPlaceIRPass
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether {@link #run(Object)} returns its own argument, having mutated it.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Get a short name for this pass, for error messages and logs.
     *
     * @return The name.
     */
    default String describe() {
        String name = getClass().getSimpleName();
        int lambda = name.indexOf("$$Lambda");
        return lambda < 0 ? name : "lambda in " + name.substring(0, lambda);
    }

    /**
     * Run {@code next} on the result of this pass.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type of {@code next}.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
