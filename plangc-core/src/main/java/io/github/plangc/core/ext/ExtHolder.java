package io.github.plangc.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of the IR objects, storing exts in attachment order.
 * <p>
 * Not thread-safe; IR is only ever touched by the compilation that built it.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> exts;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (exts == null) exts = new LinkedHashMap<>();
        exts.put(ext, ext.check(value));
    }

    @Override
    public void removeExt(Ext<?> ext) {
        if (exts != null) exts.remove(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return exts == null ? null : (T) exts.get(ext);
    }
}
