package io.github.plangc.core.ir;

/**
 * What a function hands back to its caller.
 */
public enum ReturnKind {
    /**
     * A governance decision, produced by an {@link Action}.
     */
    DECISION,
    /**
     * A plain value, produced by a {@link Return}.
     */
    VALUE
}
