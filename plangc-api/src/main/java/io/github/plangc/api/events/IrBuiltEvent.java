package io.github.plangc.api.events;

import io.github.plangc.api.PolicyCompilation;
import io.github.plangc.core.ir.Module;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired just after the program is lowered to IR, before any optimisation.
 * <p>
 * Listeners may rewrite the module, or replace it outright.
 *
 * @see PolicyCompilation
 */
public class IrBuiltEvent implements ModuleCompileEvent {
    /**
     * The freshly built IR.
     */
    @NotNull
    public Module module;

    /**
     * Construct a new IrBuiltEvent over the given IR.
     *
     * @param module The IR.
     */
    public IrBuiltEvent(@NotNull Module module) {
        this.module = module;
    }
}
