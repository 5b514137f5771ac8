package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A position in PLang source text, as reported by the parser.
 */
public final class SourceLocation {
    /**
     * A location for nodes that were synthesized rather than parsed.
     */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    /**
     * The name of the source file.
     */
    @NotNull
    public final String file;
    /**
     * The 1-based line, or 0 if unknown.
     */
    public final int line;
    /**
     * The 1-based column, or 0 if unknown.
     */
    public final int column;

    public SourceLocation(@NotNull String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
