package io.github.plangc.core.symbols;

import io.github.plangc.core.diag.CompileException;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Thrown when a symbol is defined twice in the same scope.
 */
public class DuplicateSymbolException extends CompileException {
    @NotNull
    private final Symbol existing;

    public DuplicateSymbolException(@NotNull Symbol duplicate, @NotNull Symbol existing) {
        super("duplicate " + duplicate.kind.name().toLowerCase(Locale.ROOT) + " '" + duplicate.name
                        + "', already declared at " + existing.location,
                duplicate.location);
        this.existing = existing;
    }

    /**
     * Get the symbol that was already defined.
     *
     * @return The earlier symbol.
     */
    @NotNull
    public Symbol getExisting() {
        return existing;
    }
}
