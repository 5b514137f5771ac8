package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * {@code when <condition> then <action>}
 */
public final class ConditionBlockNode extends StmtNode {
    @NotNull
    public final ExprNode condition;
    /**
     * The statement run when the condition holds, usually an {@link ActionBlockNode}.
     */
    @NotNull
    public final StmtNode action;

    public ConditionBlockNode(@NotNull SourceLocation location, @NotNull ExprNode condition, @NotNull StmtNode action) {
        super(location);
        this.condition = condition;
        this.action = action;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitConditionBlock(this);
    }
}
