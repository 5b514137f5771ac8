package io.github.plangc.test;

import io.github.plangc.core.ir.*;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.meta.VerifyIR;
import io.github.plangc.core.symbols.SymbolKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.github.plangc.test.Utils.loc;
import static org.junit.jupiter.api.Assertions.*;

public class VerifyIRTest {
    Module module;
    Function function;
    IRBuilder ib;

    @BeforeEach
    void setUp() {
        module = new Module("m");
        function = new Function("f", SymbolKind.POLICY, null, GovernanceMetadata.defaults(), 0, loc());
        module.addFunction(function);
        ib = new IRBuilder(module, function, function.newBlock("entry"));
    }

    String failure() {
        return assertThrows(IllegalStateException.class, () -> VerifyIR.INSTANCE.run(module)).getMessage();
    }

    @Test
    void testValid() {
        BasicBlock next = ib.newBlock("next");
        ib.condJump(ib.loadVar("x"), next, next);
        ib.setBlock(next);
        ib.action(ActionKind.DENY, null, false);
        VerifyIR.INSTANCE.run(module);
    }

    @Test
    void testUnterminated() {
        ib.loadVar("x");
        assertTrue(failure().contains("not terminated"));
    }

    @Test
    void testMissingTarget() {
        function.getEntryBlock().add(new Jump(module.newInsnId(), "nowhere"));
        assertTrue(failure().contains("missing block nowhere"));
    }

    @Test
    void testUndefinedOperand() {
        ib.condJump(999, function.getEntryBlock(), function.getEntryBlock());
        assertTrue(failure().contains("undefined value %999"));
    }

    @Test
    void testTerminatorMidBlock() {
        ib.action(ActionKind.ALLOW, null, false);
        function.getEntryBlock().getInsns().add(new LoadConst(module.newInsnId(), 1L));
        function.getEntryBlock().getInsns().add(new Action(module.newInsnId(), ActionKind.DENY, null,
                function.governance, false));
        assertTrue(failure().contains("terminator before the end"));
    }

    @Test
    void testUnreachableMayBeUnterminated() {
        ib.action(ActionKind.ALLOW, null, false);
        BasicBlock orphan = function.newBlock("orphan");
        ib.setBlock(orphan);
        ib.loadVar("y");
        VerifyIR.INSTANCE.run(module);
    }
}
