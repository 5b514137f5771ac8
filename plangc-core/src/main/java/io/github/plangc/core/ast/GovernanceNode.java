package io.github.plangc.core.ast;

import org.jetbrains.annotations.NotNull;

/**
 * The governance annotation on a policy or rule declaration.
 */
public final class GovernanceNode extends Node {
    /**
     * The declared priority. Higher is more authoritative.
     */
    public final int priority;
    /**
     * The declared audit level. Anything above zero makes the declaration governance-critical.
     */
    public final int auditLevel;

    public GovernanceNode(@NotNull SourceLocation location, int priority, int auditLevel) {
        super(location);
        if (auditLevel < 0) {
            throw new IllegalArgumentException("audit level must not be negative: " + auditLevel);
        }
        this.priority = priority;
        this.auditLevel = auditLevel;
    }
}
