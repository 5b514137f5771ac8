package io.github.plangc.core.resolve;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A semantic conflict between two policies, and how it was resolved.
 */
public final class Conflict {
    public final ConflictType type;
    /**
     * The policies involved, in declaration order.
     */
    public final List<String> policies;
    /**
     * The policy whose decision is authoritative.
     */
    public final String winner;
    /**
     * Why the winner was chosen.
     */
    public final String resolution;

    public Conflict(
            @NotNull ConflictType type,
            @NotNull String first,
            @NotNull String second,
            @NotNull String winner,
            @NotNull String resolution
    ) {
        this.type = type;
        this.policies = Collections.unmodifiableList(Arrays.asList(first, second));
        this.winner = winner;
        this.resolution = resolution;
    }

    /**
     * Get the policy that yields to the winner.
     *
     * @return The loser's name.
     */
    public String getLoser() {
        return policies.get(0).equals(winner) ? policies.get(1) : policies.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Conflict conflict = (Conflict) o;
        return type == conflict.type
                && policies.equals(conflict.policies)
                && winner.equals(conflict.winner)
                && resolution.equals(conflict.resolution);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, policies, winner, resolution);
    }

    @Override
    public String toString() {
        return type + " conflict between " + policies.get(0) + " and " + policies.get(1)
                + ": " + winner + " wins, " + resolution;
    }
}
