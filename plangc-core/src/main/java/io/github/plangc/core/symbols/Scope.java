package io.github.plangc.core.symbols;

import io.github.plangc.core.ir.Category;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * One level of the {@link SymbolTable}'s scope stack: the module, a policy body, or a rule body.
 */
public final class Scope {
    @NotNull
    public final String name;
    @NotNull
    public final Category category;
    @Nullable
    public final Scope parent;
    private final Map<SymbolKind, Map<String, Symbol>> symbols = new EnumMap<>(SymbolKind.class);

    Scope(@NotNull String name, @NotNull Category category, @Nullable Scope parent) {
        this.name = name;
        this.category = category;
        this.parent = parent;
    }

    /**
     * Look up a symbol declared directly in this scope.
     *
     * @param kind The kind of symbol.
     * @param name The simple name.
     * @return The symbol, or null.
     */
    @Nullable
    public Symbol getLocal(SymbolKind kind, String name) {
        Map<String, Symbol> ofKind = symbols.get(kind);
        return ofKind == null ? null : ofKind.get(name);
    }

    void put(Symbol symbol) {
        symbols.computeIfAbsent(symbol.kind, k -> new HashMap<>()).put(symbol.name, symbol);
    }

    @Override
    public String toString() {
        return name;
    }
}
