package io.github.plangc.core.diag;

import io.github.plangc.core.ast.SourceLocation;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A non-fatal finding about a program. Diagnostics never stop a compilation;
 * they are collected and reported alongside its result.
 */
public final class Diagnostic {
    /**
     * The kinds of finding.
     */
    public enum Kind {
        /**
         * A rule reference that no visible rule declaration matches.
         */
        UNRESOLVED_RULE,
        /**
         * A rule that is declared but never referenced.
         */
        UNREFERENCED_RULE,
        /**
         * A statement where it cannot appear, such as a rule outside any policy. It is skipped.
         */
        MISPLACED_STATEMENT,
    }

    @NotNull
    public final Kind kind;
    @NotNull
    public final String message;
    @NotNull
    public final SourceLocation location;

    public Diagnostic(@NotNull Kind kind, @NotNull String message, @NotNull SourceLocation location) {
        this.kind = kind;
        this.message = message;
        this.location = location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind && message.equals(that.message) && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, location);
    }

    @Override
    public String toString() {
        return location + ": " + kind + ": " + message;
    }
}
