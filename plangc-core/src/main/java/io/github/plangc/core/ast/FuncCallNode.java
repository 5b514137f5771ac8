package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code name(arg, ...)}, a call to a runtime-provided function.
 */
public final class FuncCallNode extends ExprNode {
    @NotNull
    public final String name;
    @NotNull
    public final List<ExprNode> args;

    public FuncCallNode(@NotNull SourceLocation location, @NotNull String name, @NotNull List<? extends ExprNode> args) {
        super(location);
        this.name = name;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFuncCall(this);
    }
}
