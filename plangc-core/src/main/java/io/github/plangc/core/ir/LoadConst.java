package io.github.plangc.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * {@code %id = const value}
 */
public final class LoadConst extends Insn {
    /**
     * A {@link Boolean}, {@link Long}, {@link Double}, {@link String}, or null.
     */
    @Nullable
    public final Object value;

    public LoadConst(int id, @Nullable Object value) {
        super(id);
        this.value = value;
    }

    @Override
    public <R> R accept(InsnVisitor<R> visitor) {
        return visitor.visitLoadConst(this);
    }
}
