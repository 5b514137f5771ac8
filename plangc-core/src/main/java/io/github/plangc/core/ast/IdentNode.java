package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

public final class IdentNode extends ExprNode {
    @NotNull
    public final String name;

    public IdentNode(@NotNull SourceLocation location, @NotNull String name) {
        super(location);
        this.name = name;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIdent(this);
    }
}
