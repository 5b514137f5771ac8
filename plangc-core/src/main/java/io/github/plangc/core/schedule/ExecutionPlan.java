package io.github.plangc.core.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The order a module's policies run in: one stage per {@link ExecutionPhase}, in phase order.
 */
public final class ExecutionPlan {
    public final List<Stage> stages;
    public final int totalPolicies;

    public ExecutionPlan(List<Stage> stages) {
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
        int total = 0;
        for (Stage stage : stages) {
            total += stage.policies.size();
        }
        this.totalPolicies = total;
    }

    /**
     * Get every policy in execution order.
     *
     * @return The policy names.
     */
    public List<String> flatten() {
        List<String> order = new ArrayList<>(totalPolicies);
        for (Stage stage : stages) {
            order.addAll(stage.policies);
        }
        return order;
    }

    /**
     * Get the stage of a phase.
     *
     * @param phase The phase.
     * @return The stage.
     */
    public Stage getStage(ExecutionPhase phase) {
        for (Stage stage : stages) {
            if (stage.phase == phase) return stage;
        }
        throw new IllegalArgumentException("No stage for " + phase);
    }

    @Override
    public String toString() {
        return "ExecutionPlan" + stages;
    }

    /**
     * The policies of one phase, in execution order. May be empty.
     */
    public static final class Stage {
        public final ExecutionPhase phase;
        public final List<String> policies;

        public Stage(ExecutionPhase phase, List<String> policies) {
            this.phase = phase;
            this.policies = Collections.unmodifiableList(new ArrayList<>(policies));
        }

        @Override
        public String toString() {
            return phase + "=" + policies;
        }
    }
}
