package io.github.plangc.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * {@code %id = op %operand}, for {@code not} and {@code -}.
 */
public final class UnaryOp extends Insn {
    @NotNull
    public final String op;
    public int operand;

    public UnaryOp(int id, @NotNull String op, int operand) {
        super(id);
        this.op = op;
        this.operand = operand;
    }

    @Override
    public List<Integer> operands() {
        return Collections.singletonList(operand);
    }

    @Override
    public void remapOperands(IntUnaryOperator remap) {
        operand = remap.applyAsInt(operand);
    }

    @Override
    public <R> R accept(InsnVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
