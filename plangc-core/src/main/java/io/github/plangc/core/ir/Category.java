package io.github.plangc.core.ir;

/**
 * The governance category of a policy.
 * <p>
 * Declaration order is precedence order: an earlier constant overrides every later one,
 * regardless of priority.
 */
public enum Category {
    SAFETY,
    PRIVACY,
    OPERATIONAL,
    ROUTING,
    CUSTOM;

    /**
     * Whether this category takes precedence over another.
     *
     * @param other The other category.
     * @return Whether this strictly outranks {@code other}.
     */
    public boolean outranks(Category other) {
        return ordinal() < other.ordinal();
    }
}
