package io.github.plangc.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * {@code jump target}
 */
public final class Jump extends Insn {
    @NotNull
    public final String target;

    public Jump(int id, @NotNull String target) {
        super(id);
        this.target = target;
    }

    @Override
    public boolean isTerminator() {
        return true;
    }

    @Override
    public List<String> targets() {
        return Collections.singletonList(target);
    }

    @Override
    public <R> R accept(InsnVisitor<R> visitor) {
        return visitor.visitJump(this);
    }
}
