package io.github.plangc.core.ext;

import io.github.plangc.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

/**
 * Something {@link Ext} values can be attached to: a module, a function, a block or an instruction.
 */
public interface ExtContainer {
    /**
     * Attach a value, replacing any previous value of the same ext.
     *
     * @param ext   The ext.
     * @param value The value, never null.
     * @param <T>   The type of the value.
     * @throws IllegalArgumentException If the value does not fit the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of an ext, if there is one.
     *
     * @param ext The ext.
     */
    void removeExt(Ext<?> ext);

    /**
     * Get the value of an ext.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     * @return The value, or null if absent.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default boolean hasExt(Ext<?> ext) {
        return getNullable(ext) != null;
    }

    /**
     * Get the value of an ext that some earlier pass must have attached.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     * @return The value.
     * @throws IllegalStateException If the ext is absent.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException(ext.getName() + " is not attached to " + this);
        }
        return value;
    }

    default <T> T getExtOr(Ext<T> ext, T dflt) {
        T value = getNullable(ext);
        return value == null ? dflt : value;
    }

    /**
     * Get the value of an analysis ext, running the analysis first if it is absent.
     *
     * @param ext      The ext.
     * @param target   What to run the analysis on, usually this container.
     * @param analysis The pass that attaches {@code ext}.
     * @param <T>      The type of the value.
     * @param <O>      The type the analysis runs on.
     * @return The value.
     * @throws IllegalStateException If the analysis did not attach the ext.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O target, IRPass<O, ?> analysis) {
        T value = getNullable(ext);
        if (value == null) {
            analysis.run(target);
            value = getExtOrThrow(ext);
        }
        return value;
    }
}
