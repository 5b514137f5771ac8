package io.github.plangc.core.diag;

import io.github.plangc.core.ast.SourceLocation;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A build-fatal error: the compilation is abandoned and nothing partial is returned.
 */
public class CompileException extends RuntimeException {
    @Nullable
    private final SourceLocation location;

    public CompileException(@NotNull String message, @Nullable SourceLocation location) {
        super(location == null ? message : location + ": " + message);
        this.location = location;
    }

    /**
     * Get the location of the offending declaration.
     *
     * @return The location, or null if the error is not tied to source.
     */
    @Nullable
    public SourceLocation getLocation() {
        return location;
    }
}
