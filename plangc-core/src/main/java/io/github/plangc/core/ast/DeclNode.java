package io.github.plangc.core.ast;

import io.github.plangc.core.ir.Category;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A declaration with a body: a policy or a rule.
 */
public abstract class DeclNode extends StmtNode {
    @NotNull
    public final String name;
    /**
     * The declared category, or null if none was written.
     */
    @Nullable
    public final Category category;
    /**
     * The governance annotation, or null if none was written.
     */
    @Nullable
    public final GovernanceNode governance;
    @NotNull
    public final List<StmtNode> body;

    protected DeclNode(
            @NotNull SourceLocation location,
            @NotNull String name,
            @Nullable Category category,
            @Nullable GovernanceNode governance,
            @NotNull List<? extends StmtNode> body
    ) {
        super(location);
        this.name = name;
        this.category = category;
        this.governance = governance;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }
}
