package io.github.plangc.api.events;

import io.github.plangc.api.PolicyCompilation;
import io.github.plangc.core.schedule.ExecutionPlan;
import org.jetbrains.annotations.NotNull;

/**
 * The last event of a compilation, fired once the execution plan is known.
 *
 * @see PolicyCompilation
 */
public class ScheduledEvent implements ModuleCompileEvent {
    /**
     * The execution plan.
     */
    @NotNull
    public final ExecutionPlan plan;
    /**
     * The plan rendered as text.
     */
    @NotNull
    public final String visualization;

    public ScheduledEvent(@NotNull ExecutionPlan plan, @NotNull String visualization) {
        this.plan = plan;
        this.visualization = visualization;
    }
}
