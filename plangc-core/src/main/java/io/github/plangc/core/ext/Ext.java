package io.github.plangc.core.ext;

import org.jetbrains.annotations.NotNull;

/**
 * A typed key for metadata on IR, such as a pass statistic or an analysis result.
 * <p>
 * Keys compare by identity, so each one should be created once, as a constant of
 * {@link CommonExts} or of the code that owns it.
 *
 * @param <T> The type of the value stored under this key.
 */
public final class Ext<T> {
    private final Class<?> type;
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a key.
     * <p>
     * {@code type} may only be the erasure of the value type, e.g. {@code List.class}
     * for an {@code Ext<List<Diagnostic>>}. Values are checked against it when attached.
     *
     * @param type The erased type of the values.
     * @param name The name, for error messages.
     * @param <T>  The erased type.
     * @param <R>  The value type.
     * @return The new key.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<T>(type, name);
    }

    @NotNull
    public String getName() {
        return name;
    }

    /**
     * Check that a value may be stored under this key.
     *
     * @param value The value.
     * @return The value.
     * @throws IllegalArgumentException If the value is null or of the wrong erased type.
     */
    T check(T value) {
        if (value == null) {
            throw new IllegalArgumentException("null value for " + name + "; remove the ext instead");
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(name + " expects a " + type.getSimpleName()
                    + ", got a " + value.getClass().getSimpleName());
        }
        return value;
    }

    @Override
    public String toString() {
        return name;
    }
}
