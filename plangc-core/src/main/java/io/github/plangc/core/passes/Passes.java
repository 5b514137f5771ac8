package io.github.plangc.core.passes;

import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.misc.ForPass;
import io.github.plangc.core.passes.opts.ConstantFolder;
import io.github.plangc.core.passes.opts.EliminateDeadBlocks;
import io.github.plangc.core.passes.opts.PolicySimplifier;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Optimisation passes to run on each function: constant folding, then dead block elimination.
     */
    public static final InPlaceIRPass<Function> FUNCTION_OPTS =
            ConstantFolder.INSTANCE
                    .thenInPlace(EliminateDeadBlocks.INSTANCE);

    /**
     * The full optimisation pipeline for a module. Idempotent: a second run changes nothing.
     */
    public static final IRPass<Module, Module> OPTIMIZE =
            ForPass.liftFunctions(FUNCTION_OPTS)
                    .then(PolicySimplifier.INSTANCE);
}
