package io.github.plangc.core.symbols;

import io.github.plangc.core.ast.SourceLocation;
import io.github.plangc.core.ir.Category;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A scoped registry of policy and rule declarations.
 * <p>
 * Scopes nest module, policy, rule (and rules may nest further). A name may be
 * redefined in an inner scope, shadowing the outer definition, but not within
 * the same scope.
 * <p>
 * A table belongs to a single build; it is not thread-safe and must not be shared.
 */
public final class SymbolTable {
    private static final Logger LOG = LoggerFactory.getLogger(SymbolTable.class);

    /**
     * The name of the outermost scope.
     */
    public static final String MODULE_SCOPE = "<module>";

    private final Scope root = new Scope(MODULE_SCOPE, Category.CUSTOM, null);
    private Scope current = root;
    private int depth = 0;
    private final List<Symbol> allSymbols = new ArrayList<>();
    private final List<UnresolvedReference> unresolved = new ArrayList<>();

    /**
     * Define a symbol in the current scope.
     *
     * @param symbol The symbol.
     * @throws DuplicateSymbolException If a symbol of the same kind and name is already in the current scope.
     */
    public void define(@NotNull Symbol symbol) {
        Symbol existing = current.getLocal(symbol.kind, symbol.name);
        if (existing != null) {
            throw new DuplicateSymbolException(symbol, existing);
        }
        current.put(symbol);
        allSymbols.add(symbol);
    }

    /**
     * Open a new scope nested in the current one.
     *
     * @param name     The name of the scope, usually the declaration's qualified name.
     * @param category The category of the declaration owning the scope.
     * @return The new scope.
     */
    public Scope enterScope(@NotNull String name, @NotNull Category category) {
        current = new Scope(name, category, current);
        depth++;
        return current;
    }

    /**
     * Close the current scope, returning to its parent.
     *
     * @throws UnbalancedScopeException If the current scope is the module scope.
     */
    public void exitScope() {
        if (current.parent == null) {
            throw new UnbalancedScopeException("exit from the module scope", null);
        }
        current = current.parent;
        depth--;
    }

    /**
     * Check that every scope entered has been exited.
     *
     * @param location Where the build ended, for the error.
     * @throws UnbalancedScopeException If a scope is still open.
     */
    public void checkBalanced(@Nullable SourceLocation location) {
        if (current != root) {
            throw new UnbalancedScopeException("scope '" + current.name + "' was never closed", location);
        }
    }

    @NotNull
    public Scope currentScope() {
        return current;
    }

    /**
     * Get how deeply the current scope is nested; 0 for the module scope.
     *
     * @return The nesting depth.
     */
    public int depth() {
        return depth;
    }

    /**
     * Find the nearest rule of the given name, searching outward from the current scope.
     *
     * @param name The simple name of the rule.
     * @return The rule, or null.
     */
    @Nullable
    public Symbol lookupRule(@NotNull String name) {
        return lookup(SymbolKind.RULE, name);
    }

    /**
     * Find the nearest symbol of the given kind and name, searching outward from the current scope.
     *
     * @param kind The kind of symbol.
     * @param name The simple name.
     * @return The symbol, or null.
     */
    @Nullable
    public Symbol lookup(@NotNull SymbolKind kind, @NotNull String name) {
        for (Scope scope = current; scope != null; scope = scope.parent) {
            Symbol symbol = scope.getLocal(kind, name);
            if (symbol != null) return symbol;
        }
        return null;
    }

    /**
     * Record that {@code fromFunction} refers to {@code name}.
     * <p>
     * This never fails. A name that resolves to no visible rule or policy is recorded
     * as unresolved, for the builder to report.
     *
     * @param name         The referenced name.
     * @param fromFunction The qualified name of the referring function.
     * @return The symbol the reference resolved to, or null.
     */
    @Nullable
    public Symbol addReference(@NotNull String name, @NotNull String fromFunction) {
        Symbol symbol = lookupRule(name);
        if (symbol == null) {
            symbol = lookup(SymbolKind.POLICY, name);
        }
        if (symbol == null) {
            LOG.debug("Unresolved reference to {} from {}", name, fromFunction);
            unresolved.add(new UnresolvedReference(name, fromFunction));
            return null;
        }
        symbol.addReference(fromFunction);
        return symbol;
    }

    /**
     * Set the priority of the nearest symbol with the given qualified name.
     *
     * @param qualifiedName The qualified name.
     * @param priority      The new priority.
     */
    void updatePriority(String qualifiedName, int priority) {
        for (Symbol symbol : allSymbols) {
            if (symbol.qualifiedName.equals(qualifiedName)) {
                symbol.setPriority(priority);
            }
        }
    }

    /**
     * Set the priority of the symbol owning the current scope.
     *
     * @param priority The new priority.
     */
    public void setCurrentPriority(int priority) {
        updatePriority(current.name, priority);
    }

    /**
     * Get every symbol ever defined, in definition order.
     *
     * @return The symbols.
     */
    public List<Symbol> allSymbols() {
        return Collections.unmodifiableList(allSymbols);
    }

    /**
     * Get the references that did not resolve.
     *
     * @return The unresolved references, in the order they were made.
     */
    public List<UnresolvedReference> unresolvedReferences() {
        return Collections.unmodifiableList(unresolved);
    }

    /**
     * Get the rules that were declared but never referenced.
     *
     * @return The unreferenced rules, in definition order.
     */
    public List<Symbol> unreferencedRules() {
        List<Symbol> result = new ArrayList<>();
        for (Symbol symbol : allSymbols) {
            if (symbol.kind == SymbolKind.RULE && !symbol.isReferenced()) {
                result.add(symbol);
            }
        }
        return result;
    }
}
