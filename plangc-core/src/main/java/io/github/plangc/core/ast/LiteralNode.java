package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A literal: a {@link Boolean}, a {@link Long}, a {@link Double}, a {@link String}, or null.
 * <p>
 * Other integral types are widened to {@link Long} and {@link Float} to {@link Double}
 * so that constants compare consistently.
 */
public final class LiteralNode extends ExprNode {
    @Nullable
    public final Object value;

    public LiteralNode(@NotNull SourceLocation location, @Nullable Object value) {
        super(location);
        this.value = normalize(value);
    }

    @Nullable
    private static Object normalize(@Nullable Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value == null
                || value instanceof Long
                || value instanceof Double
                || value instanceof Boolean
                || value instanceof String) {
            return value;
        }
        throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
