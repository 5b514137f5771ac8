package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * {@code not x} or {@code -x}.
 */
public final class UnaryOpNode extends ExprNode {
    @NotNull
    public final String op;
    @NotNull
    public final ExprNode operand;

    public UnaryOpNode(@NotNull SourceLocation location, @NotNull String op, @NotNull ExprNode operand) {
        super(location);
        this.op = op;
        this.operand = operand;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
