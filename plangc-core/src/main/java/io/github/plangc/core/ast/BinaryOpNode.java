package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * {@code left <op> right}, where {@code op} is a comparison, {@code and}, {@code or}, or arithmetic.
 */
public final class BinaryOpNode extends ExprNode {
    @NotNull
    public final String op;
    @NotNull
    public final ExprNode left;
    @NotNull
    public final ExprNode right;

    public BinaryOpNode(@NotNull SourceLocation location, @NotNull String op, @NotNull ExprNode left, @NotNull ExprNode right) {
        super(location);
        this.op = op;
        this.left = left;
        this.right = right;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
