package io.github.plangc.core.passes.opts;

import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.*;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;

/**
 * An optimisation pass that evaluates operators whose operands are constants
 * loaded in the same block.
 * <p>
 * A folded instruction is replaced in place by a {@link LoadConst} with a fresh ID,
 * and every later use of its result is redirected to the new constant. Operations
 * that would fail or whose meaning depends on runtime typing, such as division by
 * zero, overflow, or ordering a string against a number, are left alone.
 * <p>
 * The number of folds made is attached as {@link CommonExts#FOLDED_COUNT}.
 */
public class ConstantFolder implements InPlaceIRPass<Function> {
    private static final Logger LOG = LoggerFactory.getLogger(ConstantFolder.class);

    /**
     * An instance of this pass.
     */
    public static final ConstantFolder INSTANCE = new ConstantFolder();

    @Override
    public void runInPlace(Function function) {
        Module module = function.getExtOrThrow(CommonExts.OWNING_MODULE);
        Map<Integer, Integer> replaced = new HashMap<>();
        int folded = 0;
        for (BasicBlock block : function.getBlocks()) {
            Map<Integer, Object> consts = new HashMap<>();
            ListIterator<Insn> it = block.getInsns().listIterator();
            while (it.hasNext()) {
                Insn insn = it.next();
                insn.remapOperands(id -> replaced.getOrDefault(id, id));
                if (insn instanceof LoadConst) {
                    consts.put(insn.id, ((LoadConst) insn).value);
                    continue;
                }
                Object result = foldInsn(insn, consts);
                if (result == null) continue;
                LoadConst constant = new LoadConst(module.newInsnId(), result);
                it.set(constant);
                consts.put(constant.id, result);
                replaced.put(insn.id, constant.id);
                folded++;
            }
        }
        if (folded > 0) {
            // uses in blocks visited before the fold
            for (BasicBlock block : function.getBlocks()) {
                for (Insn insn : block.getInsns()) {
                    insn.remapOperands(id -> replaced.getOrDefault(id, id));
                }
            }
            LOG.debug("Folded {} instructions in {}", folded, function.name);
            CommonExts.functionChanged(function);
        }
        function.attachExt(CommonExts.FOLDED_COUNT, folded);
    }

    /**
     * Sum the folds made by the last run over each function of a module.
     *
     * @param module The module.
     * @return The total number of folds.
     */
    public static int foldedCount(Module module) {
        int total = 0;
        for (Function function : module.getFunctions()) {
            total += function.getExtOr(CommonExts.FOLDED_COUNT, 0);
        }
        return total;
    }

    @Nullable
    private static Object foldInsn(Insn insn, Map<Integer, Object> consts) {
        if (insn instanceof Compare) {
            Compare cmp = (Compare) insn;
            if (!consts.containsKey(cmp.lhs) || !consts.containsKey(cmp.rhs)) return null;
            return foldBinary(cmp.op, consts.get(cmp.lhs), consts.get(cmp.rhs));
        }
        if (insn instanceof BinaryOp) {
            BinaryOp op = (BinaryOp) insn;
            if (!consts.containsKey(op.lhs) || !consts.containsKey(op.rhs)) return null;
            return foldBinary(op.op, consts.get(op.lhs), consts.get(op.rhs));
        }
        if (insn instanceof UnaryOp) {
            UnaryOp op = (UnaryOp) insn;
            if (!consts.containsKey(op.operand)) return null;
            return foldUnary(op.op, consts.get(op.operand));
        }
        return null;
    }

    /**
     * Evaluate a binary operator over constant operands.
     *
     * @param op  The operator.
     * @param lhs The left operand.
     * @param rhs The right operand.
     * @return The result, or null if the operation cannot be folded.
     */
    @Nullable
    public static Object foldBinary(String op, @Nullable Object lhs, @Nullable Object rhs) {
        switch (op) {
            case "and":
            case "or":
                if (!(lhs instanceof Boolean) || !(rhs instanceof Boolean)) return null;
                return op.equals("and")
                        ? (Boolean) lhs && (Boolean) rhs
                        : (Boolean) lhs || (Boolean) rhs;
            case "==":
                return valueEquals(lhs, rhs);
            case "!=":
                return !valueEquals(lhs, rhs);
            case "<":
            case "<=":
            case ">":
            case ">=": {
                Integer c = order(lhs, rhs);
                if (c == null) return null;
                switch (op) {
                    case "<":
                        return c < 0;
                    case "<=":
                        return c <= 0;
                    case ">":
                        return c > 0;
                    default:
                        return c >= 0;
                }
            }
            case "+":
                if (lhs instanceof String && rhs instanceof String) {
                    return (String) lhs + rhs;
                }
                // fallthrough
            case "-":
            case "*":
            case "/":
            case "%":
                if (!(lhs instanceof Number) || !(rhs instanceof Number)) return null;
                return arithmetic(op, (Number) lhs, (Number) rhs);
            default:
                return null;
        }
    }

    /**
     * Evaluate a unary operator over a constant operand.
     *
     * @param op      The operator.
     * @param operand The operand.
     * @return The result, or null if the operation cannot be folded.
     */
    @Nullable
    public static Object foldUnary(String op, @Nullable Object operand) {
        switch (op) {
            case "not":
                return operand instanceof Boolean ? !(Boolean) operand : null;
            case "-":
                if (operand instanceof Long) {
                    long v = (Long) operand;
                    return v == Long.MIN_VALUE ? null : -v;
                }
                return operand instanceof Double ? -(Double) operand : null;
            default:
                return null;
        }
    }

    private static boolean valueEquals(@Nullable Object lhs, @Nullable Object rhs) {
        if (lhs instanceof Number && rhs instanceof Number) {
            return compareNumbers((Number) lhs, (Number) rhs) == 0;
        }
        return Objects.equals(lhs, rhs);
    }

    @Nullable
    private static Integer order(@Nullable Object lhs, @Nullable Object rhs) {
        if (lhs instanceof Number && rhs instanceof Number) {
            return compareNumbers((Number) lhs, (Number) rhs);
        }
        if (lhs instanceof String && rhs instanceof String) {
            return ((String) lhs).compareTo((String) rhs);
        }
        return null;
    }

    private static int compareNumbers(Number lhs, Number rhs) {
        if (lhs instanceof Long && rhs instanceof Long) {
            return Long.compare((Long) lhs, (Long) rhs);
        }
        return Double.compare(lhs.doubleValue(), rhs.doubleValue());
    }

    @Nullable
    private static Object arithmetic(String op, Number lhs, Number rhs) {
        if (op.equals("/")) {
            // true division
            if (rhs.doubleValue() == 0) return null;
            return lhs.doubleValue() / rhs.doubleValue();
        }
        if (lhs instanceof Long && rhs instanceof Long) {
            long a = (Long) lhs;
            long b = (Long) rhs;
            try {
                switch (op) {
                    case "+":
                        return Math.addExact(a, b);
                    case "-":
                        return Math.subtractExact(a, b);
                    case "*":
                        return Math.multiplyExact(a, b);
                    default:
                        if (b == 0) return null;
                        return a % b;
                }
            } catch (ArithmeticException e) {
                LOG.trace("Not folding overflowing {} {} {}", a, op, b);
                return null;
            }
        }
        double a = lhs.doubleValue();
        double b = rhs.doubleValue();
        switch (op) {
            case "+":
                return a + b;
            case "-":
                return a - b;
            case "*":
                return a * b;
            default:
                if (b == 0) return null;
                return a % b;
        }
    }
}
