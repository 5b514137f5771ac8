package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * An expression, as it appears in a condition.
 */
public abstract class ExprNode extends Node {
    protected ExprNode(@NotNull SourceLocation location) {
        super(location);
    }

    /**
     * Dispatch on the kind of this expression.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visit method for this kind.
     */
    public abstract <R> R accept(ExprVisitor<R> visitor);
}
