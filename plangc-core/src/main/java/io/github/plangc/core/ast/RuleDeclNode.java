package io.github.plangc.core.ast;

import io.github.plangc.core.ir.Category;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * {@code rule name { body }}, nested in a policy or another rule.
 */
public final class RuleDeclNode extends DeclNode {
    public RuleDeclNode(
            @NotNull SourceLocation location,
            @NotNull String name,
            @Nullable Category category,
            @Nullable GovernanceNode governance,
            @NotNull List<? extends StmtNode> body
    ) {
        super(location, name, category, governance, body);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitRuleDecl(this);
    }
}
