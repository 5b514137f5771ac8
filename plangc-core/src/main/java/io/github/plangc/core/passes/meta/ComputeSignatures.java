package io.github.plangc.core.passes.meta;

import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.*;
import io.github.plangc.core.passes.InPlaceIRPass;
import io.github.plangc.core.util.BlockGraph;
import io.github.plangc.core.util.IRPrinter;

import java.util.*;

/**
 * Computes the {@link CommonExts#CONDITION_SIGNATURE condition signature} and
 * {@link CommonExts#TERMINAL_ACTIONS terminal actions} of a function.
 * <p>
 * The signature renders the expression tree behind each reachable conditional
 * jump, in block order. Variable names and constant values are kept, operands of
 * commutative operators are sorted, and {@code >}/{@code >=} are flipped to
 * {@code <}/{@code <=}, so two functions guarded by the same conditions written
 * differently still agree.
 */
public class ComputeSignatures implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this class.
     */
    public static final ComputeSignatures INSTANCE = new ComputeSignatures();

    private static final Set<String> COMMUTATIVE = new HashSet<>(Arrays.asList(
            "==", "!=", "and", "or", "+", "*"));

    @Override
    public void runInPlace(Function func) {
        Set<BasicBlock> reachable = BlockGraph.reachable(func);
        Map<Integer, Insn> defs = new HashMap<>();
        for (BasicBlock block : func.getBlocks()) {
            for (Insn insn : block.getInsns()) {
                defs.put(insn.id, insn);
            }
        }

        Renderer renderer = new Renderer(defs);
        StringJoiner signature = new StringJoiner(";");
        EnumSet<ActionKind> explicit = EnumSet.noneOf(ActionKind.class);
        for (BasicBlock block : func.getBlocks()) {
            if (!reachable.contains(block)) continue;
            Insn terminator = block.getTerminator();
            if (terminator instanceof CondJump) {
                signature.add(renderer.render(((CondJump) terminator).cond));
            } else if (terminator instanceof Action) {
                Action action = (Action) terminator;
                if (!action.synthesized) explicit.add(action.kind);
            }
        }
        if (explicit.isEmpty()) explicit.add(ActionKind.ALLOW);

        func.attachExt(CommonExts.CONDITION_SIGNATURE, signature.toString());
        func.attachExt(CommonExts.TERMINAL_ACTIONS, Collections.unmodifiableSet(explicit));
    }

    /**
     * Get the condition signature of a function, computing it if needed.
     *
     * @param func The function.
     * @return The signature.
     */
    public static String signatureOf(Function func) {
        return func.getExtOrRun(CommonExts.CONDITION_SIGNATURE, func, INSTANCE);
    }

    /**
     * Get the terminal actions of a function, computing them if needed.
     *
     * @param func The function.
     * @return The terminal actions.
     */
    public static Set<ActionKind> terminalActionsOf(Function func) {
        return func.getExtOrRun(CommonExts.TERMINAL_ACTIONS, func, INSTANCE);
    }

    private static class Renderer implements InsnVisitor<String> {
        private final Map<Integer, Insn> defs;

        Renderer(Map<Integer, Insn> defs) {
            this.defs = defs;
        }

        String render(int id) {
            Insn def = defs.get(id);
            return def == null ? "?" : def.accept(this);
        }

        private String binary(String op, int lhs, int rhs) {
            String l = render(lhs);
            String r = render(rhs);
            switch (op) {
                case ">":
                    return "<(" + r + "," + l + ")";
                case ">=":
                    return "<=(" + r + "," + l + ")";
            }
            if (COMMUTATIVE.contains(op) && l.compareTo(r) > 0) {
                String t = l;
                l = r;
                r = t;
            }
            return op + "(" + l + "," + r + ")";
        }

        @Override
        public String visitLoadConst(LoadConst insn) {
            return IRPrinter.renderConst(insn.value);
        }

        @Override
        public String visitLoadVar(LoadVar insn) {
            return insn.name;
        }

        @Override
        public String visitBinaryOp(BinaryOp insn) {
            return binary(insn.op, insn.lhs, insn.rhs);
        }

        @Override
        public String visitUnaryOp(UnaryOp insn) {
            return insn.op + "(" + render(insn.operand) + ")";
        }

        @Override
        public String visitCompare(Compare insn) {
            return binary(insn.op, insn.lhs, insn.rhs);
        }

        @Override
        public String visitCall(Call insn) {
            StringJoiner sj = new StringJoiner(",", insn.target + "(", ")");
            for (int arg : insn.operands()) {
                sj.add(render(arg));
            }
            return sj.toString();
        }

        // control flow and effects never feed a condition

        @Override
        public String visitJump(Jump insn) {
            return "?";
        }

        @Override
        public String visitCondJump(CondJump insn) {
            return "?";
        }

        @Override
        public String visitReturn(Return insn) {
            return "?";
        }

        @Override
        public String visitAction(Action insn) {
            return "?";
        }

        @Override
        public String visitEmitIntent(EmitIntent insn) {
            return "?";
        }
    }
}
