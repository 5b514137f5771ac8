package io.github.plangc.core.symbols;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A reference to a name that no visible rule or policy declared.
 */
public final class UnresolvedReference {
    @NotNull
    public final String name;
    /**
     * The qualified name of the function the reference was made from.
     */
    @NotNull
    public final String fromFunction;

    public UnresolvedReference(@NotNull String name, @NotNull String fromFunction) {
        this.name = name;
        this.fromFunction = fromFunction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnresolvedReference that = (UnresolvedReference) o;
        return name.equals(that.name) && fromFunction.equals(that.fromFunction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fromFunction);
    }

    @Override
    public String toString() {
        return name + " (from " + fromFunction + ")";
    }
}
