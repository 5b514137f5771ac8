package io.github.plangc.test;

import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.Category;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.opts.MergeCandidate;
import io.github.plangc.core.passes.opts.PolicySimplifier;
import io.github.plangc.core.util.IRPrinter;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.plangc.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class PolicySimplifierTest {
    @Test
    void testCandidates() {
        Module module = build(program(
                policy("a", Category.PRIVACY, when(ident("pii"), deny())),
                policy("b", Category.PRIVACY, escalate("dpo")),
                policy("c", Category.PRIVACY, when(ident("ok"), allow())),
                policy("d", Category.ROUTING, route("x")),
                policy("e", Category.ROUTING, allow())));
        String before = IRPrinter.print(module);

        PolicySimplifier.INSTANCE.run(module);

        List<MergeCandidate> candidates = module.getExtOrThrow(CommonExts.MERGE_CANDIDATES);
        assertEquals(Arrays.asList(
                new MergeCandidate("a", "b", Category.PRIVACY),
                new MergeCandidate("d", "e", Category.ROUTING)), candidates);
        // analysis only
        assertEquals(before, IRPrinter.print(module));
    }

    @Test
    void testRulesAreNotCandidates() {
        Module module = build(program(policy("p", Category.SAFETY,
                ref("x"), ref("y"),
                rule("x", deny()),
                rule("y", deny()))));
        PolicySimplifier.INSTANCE.run(module);
        assertTrue(module.getExtOrThrow(CommonExts.MERGE_CANDIDATES).isEmpty());
    }
}
