package io.github.plangc.core.symbols;

/**
 * The kinds of declaration a {@link Symbol} can name.
 */
public enum SymbolKind {
    POLICY,
    RULE
}
