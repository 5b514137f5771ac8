package io.github.plangc.test;

import io.github.plangc.core.ir.*;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.symbols.SymbolKind;
import io.github.plangc.core.util.IRPrinter;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.github.plangc.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class IRPrinterTest {
    @Test
    void testPrintModule() {
        Module module = build(program(
                importOf("std"),
                policy("p", Category.SAFETY, 5, 1,
                        when(bin("<", ident("risk"), lit(3)), escalate("oncall")))));
        String expected = "module main\n"
                + "import \"std\"\n"
                + "\n"
                + "policy p(ctx) -> DECISION [SAFETY priority=5 audit=1] {\n"
                + "  entry:\n"
                + "    %1 = load risk\n"
                + "    %2 = const 3\n"
                + "    %3 = cmp < %1, %2\n"
                + "    br %3 ? then.0 : else.1\n"
                + "  then.0:\n"
                + "    %5 = const \"oncall\"\n"
                + "    emit ESCALATE(%5) priority=5 confirm !audit=1\n"
                + "    action ESCALATE -> oncall !audit=1\n"
                + "  else.1:\n"
                + "    jump merge.2\n"
                + "  merge.2:\n"
                + "    action ALLOW (implicit) !audit=1\n"
                + "}\n";
        assertEquals(expected, IRPrinter.print(module));
        assertEquals(expected, module.toString());
        assertEquals(9, module.instructionCount());
    }

    @Test
    void testRenderInsns() {
        Module module = new Module("m");
        Function f = new Function("f", SymbolKind.RULE, "p", GovernanceMetadata.defaults(), 0, loc());
        module.addFunction(f);
        IRBuilder ib = new IRBuilder(module, f, f.newBlock("entry"));
        int s = ib.loadConst("say \"hi\"\n");
        int neg = ib.unaryOp("-", ib.loadConst(2.5));
        ib.call("f", Arrays.asList(s, neg));
        ib.ret(neg);

        String printed = IRPrinter.print(f);
        assertTrue(printed.startsWith("rule f(ctx) -> DECISION [CUSTOM priority=0 audit=0] {\n"));
        assertTrue(printed.contains("%1 = const \"say \\\"hi\\\"\\n\"\n"));
        assertTrue(printed.contains("%3 = - %2\n"));
        assertTrue(printed.contains("%4 = call f(%1, %3)\n"));
        assertTrue(printed.contains("ret %3\n"));
        assertEquals("null", IRPrinter.renderConst(null));
        assertEquals(5, f.instructionCount());
        assertEquals(5, module.instructionCount());
    }
}
