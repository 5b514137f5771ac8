package io.github.plangc.core.ir;

import java.util.Comparator;

/**
 * The total order in which policies take precedence over one another.
 * <p>
 * Category first, absolutely; then higher priority; then earlier declaration.
 * Conflict resolution and scheduling both use this order, so the policy that
 * wins a conflict is always the one that runs first.
 */
public final class Precedence {
    /**
     * Orders functions so that the most authoritative comes first.
     */
    public static final Comparator<Function> ORDER = Comparator
            .comparing((Function f) -> f.governance.getCategory())
            .thenComparing(Comparator.comparingInt((Function f) -> f.governance.getPriority()).reversed())
            .thenComparingInt(f -> f.declarationIndex);

    private Precedence() {
    }

    /**
     * Pick the authoritative function of two.
     *
     * @param a One function.
     * @param b Another function.
     * @return Whichever takes precedence.
     */
    public static Function winner(Function a, Function b) {
        return ORDER.compare(a, b) <= 0 ? a : b;
    }

    /**
     * Describe which rule of the order decided between a winner and a loser.
     *
     * @param winner The function that takes precedence.
     * @param loser  The function that yields.
     * @return A human-readable reason.
     */
    public static String explain(Function winner, Function loser) {
        GovernanceMetadata w = winner.governance;
        GovernanceMetadata l = loser.governance;
        if (w.getCategory() != l.getCategory()) {
            return "category " + w.getCategory() + " overrides " + l.getCategory();
        }
        if (w.getPriority() != l.getPriority()) {
            return "priority " + w.getPriority() + " overrides " + l.getPriority()
                    + " within " + w.getCategory();
        }
        return "declared first (priority " + w.getPriority() + " tied within " + w.getCategory() + ")";
    }
}
