package io.github.plangc.api.events;

import io.github.plangc.api.PolicyCompilation;
import io.github.plangc.core.resolve.Resolution;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired once conflicts between policies have been found and resolved.
 *
 * @see PolicyCompilation
 */
public class ResolvedEvent implements ModuleCompileEvent {
    @NotNull
    public final Resolution resolution;

    public ResolvedEvent(@NotNull Resolution resolution) {
        this.resolution = resolution;
    }
}
