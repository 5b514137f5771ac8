package io.github.plangc.api;

import io.github.plangc.api.events.*;
import io.github.plangc.core.ast.*;
import io.github.plangc.core.diag.Diagnostic;
import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.ActionKind;
import io.github.plangc.core.ir.Category;
import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.resolve.ConflictType;
import io.github.plangc.core.symbols.DuplicateSymbolException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

public class PolicyCompilerTest {
    static final SourceLocation LOC = new SourceLocation("api.plang", 1, 1);

    static PolicyDeclNode policy(String name, Category category, int priority, StmtNode... body) {
        return new PolicyDeclNode(LOC, name, category, new GovernanceNode(LOC, priority, 0), Arrays.asList(body));
    }

    static ProgramNode sample() {
        return new ProgramNode(LOC, Arrays.asList(
                policy("block_pii", Category.SAFETY, 0,
                        new ConditionBlockNode(LOC,
                                new BinaryOpNode(LOC, "<", new LiteralNode(LOC, 10), new LiteralNode(LOC, 20)),
                                new ActionBlockNode(LOC, ActionKind.DENY))),
                policy("open", Category.CUSTOM, 50, new ActionBlockNode(LOC, ActionKind.ALLOW)),
                policy("also_open", Category.CUSTOM, 50,
                        new RuleRefNode(LOC, "missing"),
                        new ActionBlockNode(LOC, ActionKind.ALLOW)),
                policy("to_fast", Category.ROUTING, 0,
                        new ConditionBlockNode(LOC,
                                new IdentNode(LOC, "fast_lane"),
                                new RouteTargetNode(LOC, "fast")))));
    }

    @Test
    void testCompile() {
        CompilationResult result = new PolicyCompiler().compile(sample());
        assertEquals("main", result.module.name);
        assertEquals(Arrays.asList("block_pii", "to_fast", "open", "also_open"), result.getExecutionOrder());
        assertEquals(4, result.plan.totalPolicies);

        assertEquals(1, result.conflicts.size());
        assertEquals(ConflictType.PRIORITY, result.conflicts.get(0).type);
        assertEquals("open", result.conflicts.get(0).winner);

        assertEquals(1, result.diagnostics.size());
        assertEquals(Diagnostic.Kind.UNRESOLVED_RULE, result.diagnostics.get(0).kind);
        assertEquals(1, result.mergeCandidates.size());
        assertEquals(64, result.fingerprint.length());

        Function blockPii = result.module.getFunction("block_pii");
        assertNotNull(blockPii);
        assertEquals(1, (int) blockPii.getExtOrThrow(CommonExts.FOLDED_COUNT));
    }

    @Test
    void testOptionsAndDeterminism() {
        CompilerOptions options = CompilerOptions.builder()
                .setModuleName("tenant-42")
                .setOptimize(false)
                .setVerify(true)
                .build();
        PolicyCompiler compiler = new PolicyCompiler(options);
        CompilationResult first = compiler.compile(sample());
        CompilationResult second = compiler.compile(sample());
        assertEquals("tenant-42", first.module.name);
        assertEquals(first.fingerprint, second.fingerprint);
        assertTrue(first.mergeCandidates.isEmpty());

        CompilationResult optimized = new PolicyCompiler(options.toBuilder().setOptimize(true).build())
                .compile(sample());
        assertNotEquals(first.fingerprint, optimized.fingerprint);

        assertThrows(IllegalArgumentException.class, () -> CompilerOptions.builder().setModuleName(""));
    }

    @Test
    void testEvents() {
        PolicyCompiler compiler = new PolicyCompiler();
        List<String> seen = new ArrayList<>();
        compiler.listen(RunCompilationEvent.class, evt -> seen.add("run"));
        compiler.lift().listen(IrBuiltEvent.class, evt -> seen.add("built " + evt.module.name));
        compiler.lift().listen(OptimizedEvent.class, evt -> seen.add("optimized " + evt.optimized));
        compiler.lift().listen(ResolvedEvent.class, evt -> seen.add("resolved " + evt.resolution.conflicts.size()));
        BlockingQueue<ScheduledEvent> plans = compiler.plansAsQueue();

        PolicyCompilation compilation = compiler.submit(sample());
        compilation.listen(ScheduledEvent.class, evt -> seen.add("scheduled " + evt.plan.totalPolicies));
        compilation.run();

        assertEquals(Arrays.asList("run", "built main", "optimized true", "resolved 1", "scheduled 4"), seen);
        ScheduledEvent scheduled = plans.poll();
        assertNotNull(scheduled);
        assertTrue(scheduled.visualization.contains("SAFETY_CHECK: block_pii"));
        assertNull(plans.poll());
    }

    @Test
    void testRemovingListeners() {
        PolicyCompiler compiler = new PolicyCompiler();
        List<String> seen = new ArrayList<>();
        Runnable remove = compiler.lift().listen(IrBuiltEvent.class, evt -> seen.add(evt.module.name));
        assertTrue(compiler.hasListeners(RunCompilationEvent.class));

        compiler.compile(sample());
        remove.run();
        compiler.compile(sample());

        assertEquals(Collections.singletonList("main"), seen);
        assertFalse(compiler.hasListeners(RunCompilationEvent.class));
    }

    @Test
    void testListenerFailureNamesEvent() {
        PolicyCompiler compiler = new PolicyCompiler();
        compiler.lift().listen(ResolvedEvent.class, evt -> {
            throw new IllegalStateException("rejected");
        });
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> compiler.compile(sample()));
        assertEquals("rejected", e.getMessage());
        assertTrue(e.getSuppressed()[0].getMessage().contains("ResolvedEvent"));
    }

    @Test
    void testListenerMayReplaceModule() {
        PolicyCompiler compiler = new PolicyCompiler();
        compiler.lift().listen(IrBuiltEvent.class, evt -> {
            Module replacement = new Module("empty");
            replacement.attachExt(CommonExts.DIAGNOSTICS, Collections.<Diagnostic>emptyList());
            evt.module = replacement;
        });
        CompilationResult result = compiler.compile(sample());
        assertEquals("empty", result.module.name);
        assertEquals(0, result.plan.totalPolicies);
        assertTrue(result.conflicts.isEmpty());
    }

    @Test
    void testFatalErrorsPropagate() {
        ProgramNode duplicated = new ProgramNode(LOC, Arrays.asList(
                policy("p", Category.SAFETY, 0),
                policy("p", Category.CUSTOM, 0)));
        assertThrows(DuplicateSymbolException.class, () -> new PolicyCompiler().compile(duplicated));
    }
}
