package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root of a parsed PLang source: an ordered list of top-level statements.
 */
public final class ProgramNode extends Node {
    /**
     * The top-level statements, in source order.
     */
    @NotNull
    public final List<StmtNode> statements;

    public ProgramNode(@NotNull SourceLocation location, @NotNull List<? extends StmtNode> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }
}
