package io.github.plangc.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * {@code ret [%value]}
 */
public final class Return extends Insn {
    /**
     * The returned value's ID, or null for a bare return.
     */
    @Nullable
    public Integer value;

    public Return(int id, @Nullable Integer value) {
        super(id);
        this.value = value;
    }

    @Override
    public List<Integer> operands() {
        return value == null ? Collections.emptyList() : Collections.singletonList(value);
    }

    @Override
    public void remapOperands(IntUnaryOperator remap) {
        if (value != null) {
            value = remap.applyAsInt(value);
        }
    }

    @Override
    public boolean isTerminator() {
        return true;
    }

    @Override
    public <R> R accept(InsnVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
