package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * {@code import "path"}. The path is opaque to the compiler.
 */
public final class ImportNode extends StmtNode {
    @NotNull
    public final String path;

    public ImportNode(@NotNull SourceLocation location, @NotNull String path) {
        super(location);
        this.path = path;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitImport(this);
    }
}
