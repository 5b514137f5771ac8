package io.github.plangc.core.resolve;

/**
 * The kind of a {@link Conflict}.
 */
public enum ConflictType {
    /**
     * Two policies guarded by the same conditions decide differently.
     */
    ACTION,
    /**
     * Two policies share a category and priority, so only declaration order separates them.
     */
    PRIORITY,
}
