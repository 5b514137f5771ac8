package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * A reference to a rule by its simple name, which runs that rule.
 */
public final class RuleRefNode extends StmtNode {
    @NotNull
    public final String name;

    public RuleRefNode(@NotNull SourceLocation location, @NotNull String name) {
        super(location);
        this.name = name;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitRuleRef(this);
    }
}
