package io.github.plangc.core.passes;

/**
 * A pass that mutates its input and hands the same object on, such as an optimisation
 * over a {@link io.github.plangc.core.ir.Function} or an analysis that only attaches exts.
 * <p>
 * Only in-place passes may be lifted over a module's functions, since a lifted pass
 * has nowhere to put a replacement function.
 *
 * @param <T> The type of IR this pass mutates.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Run the pass, mutating {@code t}.
     *
     * @param t The IR.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }

    /**
     * Compose this pass with another in-place pass over the same IR, keeping the result in-place.
     * <p>
     * Failures are reported with the index of the failing pass, as for {@link #then(IRPass)}.
     *
     * @param next The pass to run after this.
     * @return The composed pass.
     */
    default InPlaceIRPass<T> thenInPlace(InPlaceIRPass<T> next) {
        IRPass<T, T> chain = then(next);
        return new InPlaceIRPass<T>() {
            @Override
            public void runInPlace(T t) {
                chain.run(t);
            }

            @Override
            public String describe() {
                return chain.describe();
            }
        };
    }
}
