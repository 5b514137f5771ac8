package io.github.plangc.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * {@code %id = op %lhs, %rhs}, for {@code and}, {@code or} and arithmetic.
 */
public final class BinaryOp extends Insn {
    @NotNull
    public final String op;
    public int lhs;
    public int rhs;

    public BinaryOp(int id, @NotNull String op, int lhs, int rhs) {
        super(id);
        this.op = op;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    @Override
    public List<Integer> operands() {
        return Arrays.asList(lhs, rhs);
    }

    @Override
    public void remapOperands(IntUnaryOperator remap) {
        lhs = remap.applyAsInt(lhs);
        rhs = remap.applyAsInt(rhs);
    }

    @Override
    public <R> R accept(InsnVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
