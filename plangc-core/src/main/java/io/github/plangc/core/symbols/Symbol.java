package io.github.plangc.core.symbols;

import io.github.plangc.core.ast.SourceLocation;
import io.github.plangc.core.ir.Category;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A declared policy or rule.
 * <p>
 * Everything but the reference sites is fixed once the declaring scope closes;
 * references keep accumulating for diagnostics.
 */
public final class Symbol {
    @NotNull
    public final String name;
    /**
     * The name of the function compiled from this declaration, {@code parent.child} for nested rules.
     */
    @NotNull
    public final String qualifiedName;
    @NotNull
    public final SymbolKind kind;
    @NotNull
    public final Category category;
    private int priority;
    @NotNull
    public final SourceLocation location;
    private final Set<String> references = new LinkedHashSet<>();

    public Symbol(
            @NotNull String name,
            @NotNull String qualifiedName,
            @NotNull SymbolKind kind,
            @NotNull Category category,
            int priority,
            @NotNull SourceLocation location
    ) {
        this.name = name;
        this.qualifiedName = qualifiedName;
        this.kind = kind;
        this.category = category;
        this.priority = priority;
        this.location = location;
    }

    public int getPriority() {
        return priority;
    }

    void setPriority(int priority) {
        this.priority = priority;
    }

    void addReference(String fromFunction) {
        references.add(fromFunction);
    }

    /**
     * Get the functions that referenced this symbol, in first-reference order.
     *
     * @return The referencing function names.
     */
    public Set<String> getReferences() {
        return Collections.unmodifiableSet(references);
    }

    public boolean isReferenced() {
        return !references.isEmpty();
    }

    @Override
    public String toString() {
        return kind + " " + qualifiedName;
    }
}
