package io.github.plangc.core.resolve;

import io.github.plangc.core.ir.Module;

import java.util.Collections;
import java.util.List;

/**
 * The output of the {@link ConflictResolver}: the module, with every policy still present,
 * and the conflicts found in it.
 */
public final class Resolution {
    public final Module module;
    public final List<Conflict> conflicts;

    public Resolution(Module module, List<Conflict> conflicts) {
        this.module = module;
        this.conflicts = Collections.unmodifiableList(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
