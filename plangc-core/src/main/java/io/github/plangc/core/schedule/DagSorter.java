package io.github.plangc.core.schedule;

import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.ir.Precedence;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Orders the policies of a module into an {@link ExecutionPlan}.
 * <p>
 * The precedence graph has an edge from each policy to every policy of a later phase,
 * and to every policy of the same phase with lower priority. It is sorted topologically,
 * choosing among ready policies by {@link Precedence#ORDER}, so ties in priority
 * run in declaration order and the result is the same on every run.
 * <p>
 * A sorter is used in three steps: {@link #buildDag(Module)}, then {@link #sort()},
 * then reading the result with {@link #plan()} or {@link #visualize()}.
 * {@link #getExecutionOrder(Module)} does all three at once.
 */
public class DagSorter {
    private static final Logger LOG = LoggerFactory.getLogger(DagSorter.class);

    /**
     * The lifecycle of a sorter.
     */
    public enum State {
        NOT_BUILT,
        BUILT,
        SORTED,
    }

    private State state = State.NOT_BUILT;
    @Nullable
    private Module module;
    private final List<Function> nodes = new ArrayList<>();
    private final Map<Function, List<Function>> edges = new HashMap<>();
    @Nullable
    private ExecutionPlan plan;

    public State getState() {
        return state;
    }

    /**
     * Build the precedence graph over the top-level policies of a module,
     * discarding any previous graph.
     *
     * @param module The module.
     */
    public void buildDag(@NotNull Module module) {
        this.module = module;
        nodes.clear();
        edges.clear();
        plan = null;
        nodes.addAll(module.getPolicies());
        int edgeCount = 0;
        for (Function from : nodes) {
            List<Function> succs = new ArrayList<>();
            for (Function to : nodes) {
                if (precedes(from, to)) {
                    succs.add(to);
                }
            }
            edges.put(from, succs);
            edgeCount += succs.size();
        }
        state = State.BUILT;
        LOG.debug("Built precedence graph for {}: {} policies, {} edges", module.name, nodes.size(), edgeCount);
    }

    private static boolean precedes(Function from, Function to) {
        int phases = ExecutionPhase.of(from.governance.getCategory())
                .compareTo(ExecutionPhase.of(to.governance.getCategory()));
        if (phases != 0) return phases < 0;
        return from.governance.getPriority() > to.governance.getPriority();
    }

    /**
     * Topologically sort the graph.
     *
     * @return The execution plan.
     * @throws IllegalStateException If no graph has been built.
     */
    public ExecutionPlan sort() {
        if (state == State.NOT_BUILT) {
            throw new IllegalStateException("sort() called before buildDag()");
        }
        Map<Function, Integer> inDegree = new HashMap<>();
        for (Function node : nodes) {
            inDegree.put(node, 0);
        }
        for (List<Function> succs : edges.values()) {
            for (Function succ : succs) {
                inDegree.merge(succ, 1, Integer::sum);
            }
        }

        PriorityQueue<Function> ready = new PriorityQueue<>(Precedence.ORDER);
        for (Function node : nodes) {
            if (inDegree.get(node) == 0) ready.add(node);
        }
        Map<ExecutionPhase, List<String>> byPhase = new EnumMap<>(ExecutionPhase.class);
        for (ExecutionPhase phase : ExecutionPhase.values()) {
            byPhase.put(phase, new ArrayList<>());
        }
        int sorted = 0;
        while (!ready.isEmpty()) {
            Function next = ready.poll();
            byPhase.get(ExecutionPhase.of(next.governance.getCategory())).add(next.name);
            sorted++;
            for (Function succ : edges.get(next)) {
                if (inDegree.merge(succ, -1, Integer::sum) == 0) {
                    ready.add(succ);
                }
            }
        }
        if (sorted != nodes.size()) {
            throw new IllegalStateException("Precedence graph has a cycle");
        }

        List<ExecutionPlan.Stage> stages = new ArrayList<>();
        for (Map.Entry<ExecutionPhase, List<String>> entry : byPhase.entrySet()) {
            stages.add(new ExecutionPlan.Stage(entry.getKey(), entry.getValue()));
        }
        plan = new ExecutionPlan(stages);
        state = State.SORTED;
        return plan;
    }

    /**
     * Get the plan computed by the last {@link #sort()}.
     *
     * @return The plan.
     * @throws IllegalStateException If the graph has not been sorted.
     */
    public ExecutionPlan plan() {
        if (state != State.SORTED || plan == null) {
            throw new IllegalStateException("plan() called before sort()");
        }
        return plan;
    }

    /**
     * Build, sort, and flatten the execution order of a module.
     * The graph is reused if it was already built for this module.
     *
     * @param module The module.
     * @return The policy names in execution order.
     */
    public List<String> getExecutionOrder(@NotNull Module module) {
        if (state == State.NOT_BUILT || this.module != module) {
            buildDag(module);
        }
        if (state != State.SORTED) {
            sort();
        }
        return plan().flatten();
    }

    /**
     * Render the sorted plan as text, one line per phase, empty phases included.
     *
     * @return The rendering.
     * @throws IllegalStateException If the graph has not been sorted.
     */
    public String visualize() {
        ExecutionPlan plan = plan();
        StringBuilder sb = new StringBuilder();
        sb.append("execution plan (").append(plan.totalPolicies).append(" policies)\n");
        int i = 1;
        for (ExecutionPlan.Stage stage : plan.stages) {
            sb.append("  ").append(i++).append(". ").append(stage.phase).append(": ");
            if (stage.policies.isEmpty()) {
                sb.append("(none)");
            } else {
                sb.append(String.join(" -> ", stage.policies));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
