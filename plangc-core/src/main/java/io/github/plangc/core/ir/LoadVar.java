package io.github.plangc.core.ir;

import org.jetbrains.annotations.NotNull;

/**
 * {@code %id = load name}, reading a variable or dotted path from the execution context.
 */
public final class LoadVar extends Insn {
    @NotNull
    public final String name;

    public LoadVar(int id, @NotNull String name) {
        super(id);
        this.name = name;
    }

    @Override
    public <R> R accept(InsnVisitor<R> visitor) {
        return visitor.visitLoadVar(this);
    }
}
