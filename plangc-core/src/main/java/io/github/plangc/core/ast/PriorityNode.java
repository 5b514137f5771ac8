package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * {@code priority <value>}, overriding the priority of the enclosing declaration.
 */
public final class PriorityNode extends StmtNode {
    public final int value;

    public PriorityNode(@NotNull SourceLocation location, int value) {
        super(location);
        this.value = value;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitPriority(this);
    }
}
