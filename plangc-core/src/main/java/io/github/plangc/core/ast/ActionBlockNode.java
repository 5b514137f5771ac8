package io.github.plangc.core.ast;

import io.github.plangc.core.ir.ActionKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A governance action: {@code allow}, {@code deny}, {@code route <target>}, {@code escalate [target]}.
 */
public final class ActionBlockNode extends StmtNode {
    @NotNull
    public final ActionKind action;
    @Nullable
    public final String target;

    public ActionBlockNode(@NotNull SourceLocation location, @NotNull ActionKind action, @Nullable String target) {
        super(location);
        this.action = action;
        this.target = target;
    }

    public ActionBlockNode(@NotNull SourceLocation location, @NotNull ActionKind action) {
        this(location, action, null);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitActionBlock(this);
    }
}
