package io.github.plangc.api.events;

import io.github.plangc.api.PolicyCompilation;
import io.github.plangc.api.PolicyCompiler;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a compilation is started.
 *
 * @see PolicyCompiler
 * @see PolicyCompilation
 */
public class RunCompilationEvent implements CompilerEvent {
    /**
     * The compilation.
     */
    @NotNull
    public PolicyCompilation compilation;

    /**
     * Construct a new run compilation event.
     *
     * @param compilation The compilation.
     */
    public RunCompilationEvent(@NotNull PolicyCompilation compilation) {
        this.compilation = compilation;
    }
}
