package io.github.plangc.test;

import io.github.plangc.core.ir.Category;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.schedule.DagSorter;
import io.github.plangc.core.schedule.ExecutionPhase;
import io.github.plangc.core.schedule.ExecutionPlan;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.plangc.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class DagSorterTest {
    static Module threePhases() {
        return build(program(
                policy("p1", Category.SAFETY, deny()),
                policy("p2", Category.CUSTOM, allow()),
                policy("p3", Category.ROUTING, allow())));
    }

    @Test
    void testPhaseOrder() {
        Module module = threePhases();
        assertEquals(Arrays.asList("p1", "p3", "p2"), new DagSorter().getExecutionOrder(module));
        for (int run = 0; run < 5; run++) {
            assertEquals(Arrays.asList("p1", "p3", "p2"), new DagSorter().getExecutionOrder(threePhases()));
        }
    }

    @Test
    void testWithinPhase() {
        Module module = build(program(
                policy("low", Category.OPERATIONAL, 1, 0, allow()),
                policy("tieA", Category.OPERATIONAL, 5, 0, allow()),
                policy("high", Category.OPERATIONAL, 9, 0, allow()),
                policy("tieB", Category.OPERATIONAL, 5, 0, allow()),
                policy("bumped", Category.OPERATIONAL, 0, 0, priority(10), allow())));
        assertEquals(Arrays.asList("bumped", "high", "tieA", "tieB", "low"),
                new DagSorter().getExecutionOrder(module));
    }

    @Test
    void testPlan() {
        DagSorter sorter = new DagSorter();
        assertEquals(DagSorter.State.NOT_BUILT, sorter.getState());
        sorter.buildDag(threePhases());
        assertEquals(DagSorter.State.BUILT, sorter.getState());
        ExecutionPlan plan = sorter.sort();
        assertEquals(DagSorter.State.SORTED, sorter.getState());
        assertSame(plan, sorter.plan());

        assertEquals(3, plan.totalPolicies);
        assertEquals(ExecutionPhase.values().length, plan.stages.size());
        assertEquals(Collections.singletonList("p1"), plan.getStage(ExecutionPhase.SAFETY_CHECK).policies);
        assertTrue(plan.getStage(ExecutionPhase.PRIVACY_CHECK).policies.isEmpty());
        assertEquals(Arrays.asList("p1", "p3", "p2"), plan.flatten());
    }

    @Test
    void testVisualize() {
        DagSorter sorter = new DagSorter();
        sorter.buildDag(threePhases());
        sorter.sort();
        String expected = "execution plan (3 policies)\n"
                + "  1. SAFETY_CHECK: p1\n"
                + "  2. PRIVACY_CHECK: (none)\n"
                + "  3. OPERATIONAL: (none)\n"
                + "  4. ROUTING: p3\n"
                + "  5. CUSTOM: p2\n";
        assertEquals(expected, sorter.visualize());

        DagSorter again = new DagSorter();
        again.getExecutionOrder(threePhases());
        assertEquals(expected, again.visualize());
    }

    @Test
    void testStateErrors() {
        DagSorter sorter = new DagSorter();
        assertThrows(IllegalStateException.class, sorter::sort);
        assertThrows(IllegalStateException.class, sorter::plan);
        assertThrows(IllegalStateException.class, sorter::visualize);
        sorter.buildDag(threePhases());
        assertThrows(IllegalStateException.class, sorter::plan);
    }

    @Test
    void testEmptyModule() {
        List<String> order = new DagSorter().getExecutionOrder(build(program()));
        assertTrue(order.isEmpty());
    }

    @Test
    void testPhaseOfEveryCategory() {
        for (Category category : Category.values()) {
            assertEquals(category.ordinal(), ExecutionPhase.of(category).ordinal());
        }
    }
}
