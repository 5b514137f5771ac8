package io.github.plangc.api.events;

import io.github.plangc.api.PolicyCompilation;
import io.github.plangc.core.ir.Module;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired after the optimisation passes, or where they would have run
 * if optimisation is disabled.
 * <p>
 * This is the last chance to change the IR before conflicts are resolved.
 *
 * @see PolicyCompilation
 */
public class OptimizedEvent implements ModuleCompileEvent {
    /**
     * The IR.
     */
    @NotNull
    public Module module;

    /**
     * Whether the optimisation passes were run.
     */
    public final boolean optimized;

    /**
     * Construct a new OptimizedEvent over the given IR.
     *
     * @param module    The IR.
     * @param optimized Whether the optimisation passes were run.
     */
    public OptimizedEvent(@NotNull Module module, boolean optimized) {
        this.module = module;
        this.optimized = optimized;
    }
}
