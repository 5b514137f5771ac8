package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * A statement: a top-level declaration, or an item in a policy or rule body.
 */
public abstract class StmtNode extends Node {
    protected StmtNode(@NotNull SourceLocation location) {
        super(location);
    }

    /**
     * Dispatch on the kind of this statement.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visit method for this kind.
     */
    public abstract <R> R accept(StmtVisitor<R> visitor);
}
