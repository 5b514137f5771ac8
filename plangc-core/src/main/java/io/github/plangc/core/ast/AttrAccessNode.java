package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * {@code object.attr}
 */
public final class AttrAccessNode extends ExprNode {
    @NotNull
    public final ExprNode object;
    @NotNull
    public final String attr;

    public AttrAccessNode(@NotNull SourceLocation location, @NotNull ExprNode object, @NotNull String attr) {
        super(location);
        this.object = object;
        this.attr = attr;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAttrAccess(this);
    }
}
