package io.github.plangc.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * {@code br %cond ? ifTrue : ifFalse}
 */
public final class CondJump extends Insn {
    public int cond;
    @NotNull
    public final String ifTrue;
    @NotNull
    public final String ifFalse;

    public CondJump(int id, int cond, @NotNull String ifTrue, @NotNull String ifFalse) {
        super(id);
        this.cond = cond;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    @Override
    public List<Integer> operands() {
        return Collections.singletonList(cond);
    }

    @Override
    public void remapOperands(IntUnaryOperator remap) {
        cond = remap.applyAsInt(cond);
    }

    @Override
    public boolean isTerminator() {
        return true;
    }

    @Override
    public List<String> targets() {
        return Arrays.asList(ifTrue, ifFalse);
    }

    @Override
    public <R> R accept(InsnVisitor<R> visitor) {
        return visitor.visitCondJump(this);
    }
}
