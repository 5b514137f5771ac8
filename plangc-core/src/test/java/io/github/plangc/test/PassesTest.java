package io.github.plangc.test;

import io.github.plangc.core.ast.ProgramNode;
import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.Category;
import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.IRPass;
import io.github.plangc.core.passes.InPlaceIRPass;
import io.github.plangc.core.passes.Passes;
import io.github.plangc.core.passes.convert.AstToIr;
import io.github.plangc.core.passes.meta.VerifyIR;
import io.github.plangc.core.passes.misc.ChainedPass;
import io.github.plangc.core.passes.misc.ForPass;
import io.github.plangc.core.util.IRPrinter;
import org.junit.jupiter.api.Test;

import static io.github.plangc.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    static ProgramNode sample() {
        return program(
                importOf("std/base"),
                policy("guard", Category.SAFETY, 10, 1,
                        when(bin("and", bin(">=", lit(3), lit(2)), ident("flagged")), escalate("oncall")),
                        ref("pii"),
                        rule("pii", when(call("contains_pii", attr(ident("request"), "body")), deny())),
                        deny(),
                        allow()),
                policy("fast", Category.ROUTING, 5, 0,
                        when(bin("<", lit(1), lit(0)), route("cold")),
                        route("hot")),
                policy("fallback", null, allow()));
    }

    @Test
    void testOptimizeIsIdempotent() {
        Module module = build(sample());
        Passes.OPTIMIZE.run(module);
        String once = IRPrinter.print(module);
        String onceFingerprint = IRPrinter.fingerprint(module);
        VerifyIR.INSTANCE.run(module);

        Passes.OPTIMIZE.run(module);
        assertEquals(once, IRPrinter.print(module));
        assertEquals(onceFingerprint, IRPrinter.fingerprint(module));
        for (Function function : module.getFunctions()) {
            assertEquals(0, (int) function.getExtOrThrow(CommonExts.FOLDED_COUNT));
            assertEquals(0, (int) function.getExtOrThrow(CommonExts.ELIMINATED_BLOCKS));
        }
    }

    @Test
    void testFingerprints() {
        String first = IRPrinter.fingerprint(build(sample()));
        assertEquals(64, first.length());
        assertEquals(first, IRPrinter.fingerprint(build(sample())));

        Module changed = build(sample());
        Passes.OPTIMIZE.run(changed);
        assertNotEquals(first, IRPrinter.fingerprint(changed));
    }

    @Test
    void testChainedPass() {
        IRPass<ProgramNode, Module> pipeline = AstToIr.INSTANCE
                .then(Passes.OPTIMIZE)
                .then(VerifyIR.INSTANCE);
        assertFalse(pipeline.isInPlace());
        assertTrue(Passes.OPTIMIZE.isInPlace());
        assertNotNull(pipeline.run(sample()).getFunction("guard.pii"));
        assertEquals(4, ((ChainedPass<?, ?, ?>) pipeline).getStages().size());
        assertEquals("AstToIr -> for each function (ConstantFolder -> EliminateDeadBlocks)"
                + " -> PolicySimplifier -> VerifyIR", pipeline.describe());

        IRPass<Module, Module> failing = Passes.OPTIMIZE.then(module -> {
            throw new IllegalStateException("boom");
        });
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> failing.run(build(sample())));
        assertEquals("boom", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().contains("pass 2"));
    }

    @Test
    void testThenInPlace() {
        assertTrue(Passes.FUNCTION_OPTS.isInPlace());

        InPlaceIRPass<Function> failing = Passes.FUNCTION_OPTS.thenInPlace(function -> {
            throw new IllegalStateException("boom in " + function.name);
        });
        Module module = build(sample());
        Function guard = module.getFunction("guard");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> failing.runInPlace(guard));
        assertEquals("boom in guard", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().contains("pass 1"));
    }

    @Test
    void testLiftRequiresInPlace() {
        IRPass<Function, Function> copying = function -> function;
        assertThrows(IllegalArgumentException.class, () -> ForPass.liftFunctions(copying));
    }
}
