package io.github.plangc.core.util;

import io.github.plangc.core.ir.*;
import io.github.plangc.core.ir.Module;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Locale;

/**
 * Renders IR as deterministic text.
 * <p>
 * The same IR always renders to the same text, so the text (or its {@link #fingerprint(Module) digest})
 * can be compared across runs, stored in audit trails, and used to pin a compiled policy set.
 */
public final class IRPrinter {
    private IRPrinter() {
    }

    /**
     * Render a whole module.
     *
     * @param module The module.
     * @return The text.
     */
    public static String print(Module module) {
        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(module.name).append('\n');
        for (String path : module.imports) {
            sb.append("import ");
            appendString(sb, path);
            sb.append('\n');
        }
        for (Function function : module.getFunctions()) {
            sb.append('\n');
            print(sb, function);
        }
        return sb.toString();
    }

    /**
     * Render a single function.
     *
     * @param function The function.
     * @return The text.
     */
    public static String print(Function function) {
        StringBuilder sb = new StringBuilder();
        print(sb, function);
        return sb.toString();
    }

    private static void print(StringBuilder sb, Function function) {
        sb.append(function.kind.name().toLowerCase(Locale.ROOT))
                .append(' ')
                .append(function.name)
                .append('(')
                .append(String.join(", ", function.params))
                .append(") -> ")
                .append(function.returnKind)
                .append(" [")
                .append(function.governance)
                .append("] {\n");
        for (BasicBlock block : function.getBlocks()) {
            sb.append("  ").append(block.name).append(":\n");
            for (Insn insn : block.getInsns()) {
                sb.append("    ").append(render(insn)).append('\n');
            }
        }
        sb.append("}\n");
    }

    /**
     * Render one instruction.
     *
     * @param insn The instruction.
     * @return The text, without a trailing newline.
     */
    public static String render(Insn insn) {
        return insn.accept(RENDERER);
    }

    /**
     * Compute the SHA-256 digest of a module's rendering, as lowercase hex.
     *
     * @param module The module.
     * @return The 64-character fingerprint.
     */
    public static String fingerprint(Module module) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JVM is required to provide SHA-256
            throw new IllegalStateException(e);
        }
        byte[] hash = digest.digest(print(module).getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16))
                    .append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    /**
     * Render a constant the way it appears in IR text.
     *
     * @param value The constant.
     * @return The text.
     */
    public static String renderConst(Object value) {
        StringBuilder sb = new StringBuilder();
        if (value instanceof String) {
            appendString(sb, (String) value);
        } else {
            sb.append(value);
        }
        return sb.toString();
    }

    private static void appendString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('"');
    }

    private static String ids(List<Integer> ids) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ids.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append('%').append(ids.get(i));
        }
        return sb.toString();
    }

    private static final InsnVisitor<String> RENDERER = new InsnVisitor<String>() {
        @Override
        public String visitLoadConst(LoadConst insn) {
            return "%" + insn.id + " = const " + renderConst(insn.value);
        }

        @Override
        public String visitLoadVar(LoadVar insn) {
            return "%" + insn.id + " = load " + insn.name;
        }

        @Override
        public String visitBinaryOp(BinaryOp insn) {
            return "%" + insn.id + " = " + insn.op + " %" + insn.lhs + ", %" + insn.rhs;
        }

        @Override
        public String visitUnaryOp(UnaryOp insn) {
            return "%" + insn.id + " = " + insn.op + " %" + insn.operand;
        }

        @Override
        public String visitCompare(Compare insn) {
            return "%" + insn.id + " = cmp " + insn.op + " %" + insn.lhs + ", %" + insn.rhs;
        }

        @Override
        public String visitCall(Call insn) {
            return "%" + insn.id + " = call " + insn.target + "(" + ids(insn.operands()) + ")";
        }

        @Override
        public String visitJump(Jump insn) {
            return "jump " + insn.target;
        }

        @Override
        public String visitCondJump(CondJump insn) {
            return "br %" + insn.cond + " ? " + insn.ifTrue + " : " + insn.ifFalse;
        }

        @Override
        public String visitReturn(Return insn) {
            return insn.value == null ? "ret" : "ret %" + insn.value;
        }

        @Override
        public String visitAction(Action insn) {
            StringBuilder sb = new StringBuilder("action ").append(insn.kind);
            if (insn.target != null) sb.append(" -> ").append(insn.target);
            if (insn.synthesized) sb.append(" (implicit)");
            if (insn.isAuditCritical()) sb.append(" !audit=").append(insn.governance.getAuditLevel());
            return sb.toString();
        }

        @Override
        public String visitEmitIntent(EmitIntent insn) {
            StringBuilder sb = new StringBuilder("emit ")
                    .append(insn.intentType)
                    .append('(')
                    .append(ids(insn.operands()))
                    .append(") priority=")
                    .append(insn.getPriority());
            if (insn.requiresConfirmation) sb.append(" confirm");
            if (insn.isAuditCritical()) sb.append(" !audit=").append(insn.getGovernance().getAuditLevel());
            return sb.toString();
        }
    };
}
