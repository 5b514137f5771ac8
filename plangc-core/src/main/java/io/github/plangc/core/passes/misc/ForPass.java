package io.github.plangc.core.passes.misc;

import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.IRPass;
import io.github.plangc.core.passes.InPlaceIRPass;

import java.util.ArrayList;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift an in-place function pass to run over every function of a module, in order.
     *
     * @param pass The function pass.
     * @return The module pass.
     * @throws IllegalArgumentException If the pass is not in-place.
     */
    public static Functions liftFunctions(IRPass<Function, Function> pass) {
        if (!pass.isInPlace()) {
            throw new IllegalArgumentException("Function pass must be in-place to be lifted: " + pass);
        }
        return new Functions(pass);
    }

    /**
     * A function pass lifted to operate on a full module.
     */
    public static class Functions implements InPlaceIRPass<Module> {
        private final IRPass<Function, Function> pass;

        private Functions(IRPass<Function, Function> pass) {
            this.pass = pass;
        }

        @Override
        public void runInPlace(Module module) {
            for (Function function : new ArrayList<>(module.getFunctions())) {
                pass.run(function);
            }
        }

        @Override
        public String describe() {
            return "for each function (" + pass.describe() + ")";
        }
    }
}
