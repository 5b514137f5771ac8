package io.github.plangc.core.ir;

import org.jetbrains.annotations.NotNull;

/**
 * Governance metadata of a function, shared by the instructions that act on its behalf.
 * <p>
 * The priority is mutable only while the owning function is being built,
 * since a priority directive may appear anywhere in a body.
 */
public final class GovernanceMetadata {
    @NotNull
    private final Category category;
    private int priority;
    private final int auditLevel;

    public GovernanceMetadata(@NotNull Category category, int priority, int auditLevel) {
        if (auditLevel < 0) {
            throw new IllegalArgumentException("audit level must not be negative: " + auditLevel);
        }
        this.category = category;
        this.priority = priority;
        this.auditLevel = auditLevel;
    }

    /**
     * Create the metadata used when a declaration says nothing: CUSTOM, priority 0, not audited.
     *
     * @return Fresh default metadata.
     */
    public static GovernanceMetadata defaults() {
        return new GovernanceMetadata(Category.CUSTOM, 0, 0);
    }

    @NotNull
    public Category getCategory() {
        return category;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public int getAuditLevel() {
        return auditLevel;
    }

    /**
     * Whether anything carrying this metadata is governance-critical, and so must survive optimisation.
     *
     * @return Whether the audit level is above zero.
     */
    public boolean isAuditCritical() {
        return auditLevel > 0;
    }

    @Override
    public String toString() {
        return category + " priority=" + priority + " audit=" + auditLevel;
    }
}
