package io.github.plangc.core.symbols;

import io.github.plangc.core.ast.SourceLocation;
import io.github.plangc.core.diag.CompileException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when scopes are exited more often than entered, or left open at the end of a build.
 */
public class UnbalancedScopeException extends CompileException {
    public UnbalancedScopeException(@NotNull String message, @Nullable SourceLocation location) {
        super(message, location);
    }
}
