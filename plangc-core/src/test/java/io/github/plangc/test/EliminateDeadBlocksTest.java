package io.github.plangc.test;

import io.github.plangc.core.ast.ProgramNode;
import io.github.plangc.core.ast.StmtNode;
import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.*;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.Passes;
import io.github.plangc.core.passes.opts.EliminateDeadBlocks;
import io.github.plangc.core.util.BlockGraph;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.plangc.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class EliminateDeadBlocksTest {
    static Set<String> reachable(Function function) {
        Set<String> names = new TreeSet<>();
        for (BasicBlock block : BlockGraph.reachable(function)) {
            names.add(block.name);
        }
        return names;
    }

    @Test
    void testRemovesUnreachable() {
        Module module = build(program(policy("p", null, deny(), allow(), allow())));
        Function p = module.getFunction("p");
        assertNotNull(p);
        assertEquals(3, p.getBlocks().size());

        EliminateDeadBlocks.INSTANCE.run(p);
        assertEquals(Collections.singletonList(p.getEntry()), p.getBlockNames());
        assertEquals(2, (int) p.getExtOrThrow(CommonExts.ELIMINATED_BLOCKS));
        assertEquals(0, (int) p.getExtOrThrow(CommonExts.RETAINED_BLOCKS));
    }

    @Test
    void testReachablePreserved() {
        Module module = build(program(policy("p", null,
                when(bin("<", ident("a"), lit(1)), deny()),
                when(ident("b"), ref("r")),
                rule("r", route("elsewhere")))));
        for (Function function : module.getFunctions()) {
            Set<String> before = reachable(function);
            EliminateDeadBlocks.INSTANCE.run(function);
            assertEquals(before, reachable(function));
            assertEquals(before, new TreeSet<>(function.getBlockNames()));
        }
    }

    @Test
    void testAuditEvidenceRetained() {
        Module module = build(program(policy("p", Category.SAFETY, 0, 2, deny(), escalate("oncall"))));
        Function p = module.getFunction("p");
        assertNotNull(p);
        BasicBlock dead = blockWithPrefix(p, "dead");
        List<Insn> before = new ArrayList<>(dead.getInsns());

        EliminateDeadBlocks.INSTANCE.run(p);
        assertSame(dead, p.getBlock(dead.name));
        assertEquals(before, dead.getInsns());
        assertEquals(true, dead.getNullable(CommonExts.AUDIT_RETAINED));
        assertEquals(1, (int) p.getExtOrThrow(CommonExts.RETAINED_BLOCKS));
        assertEquals(0, (int) p.getExtOrThrow(CommonExts.ELIMINATED_BLOCKS));
    }

    @Test
    void testAuditCriticalNeverDeleted() {
        List<StmtNode[]> bodies = Arrays.asList(
                new StmtNode[]{deny(), allow()},
                new StmtNode[]{deny(), escalate("oncall"), route("queue")},
                new StmtNode[]{when(bin("==", lit(1), lit(2)), escalate("x")), deny()},
                new StmtNode[]{allow(), when(ident("y"), deny()), deny()},
                new StmtNode[]{route("a"), ref("r"), rule("r", deny(), escalate("z"))});
        for (int audit = 0; audit <= 3; audit++) {
            for (StmtNode[] body : bodies) {
                ProgramNode program = program(policy("p", Category.OPERATIONAL, 1, audit, body));
                Module module = build(program);
                Set<Integer> critical = new HashSet<>();
                for (Function function : module.getFunctions()) {
                    for (Insn insn : insns(function)) {
                        if (insn.isAuditCritical()) critical.add(insn.id);
                    }
                }
                assertEquals(audit > 0, !critical.isEmpty());

                Passes.OPTIMIZE.run(module);
                Set<Integer> after = new HashSet<>();
                for (Function function : module.getFunctions()) {
                    for (Insn insn : insns(function)) {
                        after.add(insn.id);
                    }
                }
                assertTrue(after.containsAll(critical), "audit-critical instructions survive at level " + audit);
            }
        }
    }
}
