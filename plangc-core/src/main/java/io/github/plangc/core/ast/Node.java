package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * A node of a parsed PLang program.
 */
public abstract class Node {
    /**
     * Where this node came from.
     */
    @NotNull
    public final SourceLocation location;

    protected Node(@NotNull SourceLocation location) {
        this.location = location;
    }
}
