package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * {@code route to <target>}, the statement form of a ROUTE action.
 */
public final class RouteTargetNode extends StmtNode {
    @NotNull
    public final String target;

    public RouteTargetNode(@NotNull SourceLocation location, @NotNull String target) {
        super(location);
        this.target = target;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitRouteTarget(this);
    }
}
