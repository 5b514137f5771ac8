package io.github.plangc.test;

import io.github.plangc.core.ast.ExprNode;
import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.ActionKind;
import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.meta.ComputeSignatures;
import io.github.plangc.core.passes.opts.ConstantFolder;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.EnumSet;

import static io.github.plangc.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ComputeSignaturesTest {
    static String signature(ExprNode condition) {
        Function p = build(program(policy("p", null, when(condition, deny())))).getFunction("p");
        assertNotNull(p);
        return ComputeSignatures.signatureOf(p);
    }

    @Test
    void testEquivalentConditions() {
        assertEquals(
                signature(bin(">", ident("risk"), lit(5))),
                signature(bin("<", lit(5), ident("risk"))));
        assertEquals(
                signature(bin("and", ident("a"), bin("==", lit("x"), ident("b")))),
                signature(bin("and", bin("==", ident("b"), lit("x")), ident("a"))));
        assertNotEquals(
                signature(bin("-", ident("a"), ident("b"))),
                signature(bin("-", ident("b"), ident("a"))));
        assertNotEquals(
                signature(bin("<", ident("risk"), lit(5))),
                signature(bin("<", ident("risk"), lit(6))));
    }

    @Test
    void testTerminalActions() {
        Module module = build(program(
                policy("bare", null),
                policy("guarded", null, when(ident("x"), deny()), when(ident("y"), escalate("z")))));
        Function bare = module.getFunction("bare");
        Function guarded = module.getFunction("guarded");
        assertNotNull(bare);
        assertNotNull(guarded);
        assertEquals("", ComputeSignatures.signatureOf(bare));
        assertEquals(Collections.singleton(ActionKind.ALLOW), ComputeSignatures.terminalActionsOf(bare));
        assertEquals(EnumSet.of(ActionKind.DENY, ActionKind.ESCALATE), ComputeSignatures.terminalActionsOf(guarded));
        assertEquals("x;y", ComputeSignatures.signatureOf(guarded));
    }

    @Test
    void testInvalidatedByRewrites() {
        Function p = build(program(policy("p", null, when(bin("<", lit(1), lit(2)), deny()))))
                .getFunction("p");
        assertNotNull(p);
        assertEquals("<(1,2)", ComputeSignatures.signatureOf(p));
        ConstantFolder.INSTANCE.run(p);
        assertNull(p.getNullable(CommonExts.CONDITION_SIGNATURE));
        assertEquals("true", ComputeSignatures.signatureOf(p));
    }
}
