package io.github.plangc.core.schedule;

import io.github.plangc.core.ir.Category;

/**
 * The phases policies execute in, in order. Each corresponds to exactly one {@link Category}.
 */
public enum ExecutionPhase {
    SAFETY_CHECK,
    PRIVACY_CHECK,
    OPERATIONAL,
    ROUTING,
    CUSTOM;

    /**
     * Get the phase policies of a category execute in.
     *
     * @param category The category.
     * @return The phase.
     */
    public static ExecutionPhase of(Category category) {
        switch (category) {
            case SAFETY:
                return SAFETY_CHECK;
            case PRIVACY:
                return PRIVACY_CHECK;
            case OPERATIONAL:
                return OPERATIONAL;
            case ROUTING:
                return ROUTING;
            case CUSTOM:
                return CUSTOM;
            default:
                throw new IllegalArgumentException("Unknown category " + category);
        }
    }
}
