package io.github.plangc.core.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * {@code action KIND [target]}: a governance decision, which ends the function.
 */
public final class Action extends Insn {
    @NotNull
    public final ActionKind kind;
    @Nullable
    public final String target;
    @NotNull
    public final GovernanceMetadata governance;
    /**
     * Whether the builder inserted this action because the body fell through,
     * rather than the source stating it.
     */
    public final boolean synthesized;

    public Action(
            int id,
            @NotNull ActionKind kind,
            @Nullable String target,
            @NotNull GovernanceMetadata governance,
            boolean synthesized
    ) {
        super(id);
        this.kind = kind;
        this.target = target;
        this.governance = governance;
        this.synthesized = synthesized;
    }

    @Override
    public boolean isTerminator() {
        return true;
    }

    @Override
    public @NotNull GovernanceMetadata getGovernance() {
        return governance;
    }

    @Override
    public <R> R accept(InsnVisitor<R> visitor) {
        return visitor.visitAction(this);
    }
}
