package io.github.plangc.core.ir;

import java.util.Collection;

/**
 * A terminal governance action.
 */
public enum ActionKind {
    ALLOW(true, false),
    DENY(false, false),
    ROUTE(true, true),
    ESCALATE(false, true);

    private final boolean permissive;
    private final boolean emitsIntent;

    ActionKind(boolean permissive, boolean emitsIntent) {
        this.permissive = permissive;
        this.emitsIntent = emitsIntent;
    }

    /**
     * Whether the request proceeds after this action (possibly elsewhere).
     *
     * @return Whether this action lets the request through.
     */
    public boolean isPermissive() {
        return permissive;
    }

    /**
     * Whether this action also notifies the runtime through an {@link EmitIntent}.
     *
     * @return Whether an intent is emitted alongside the action.
     */
    public boolean emitsIntent() {
        return emitsIntent;
    }

    /**
     * Whether this action contradicts another: one lets the request through and the other holds it back.
     *
     * @param other The other action.
     * @return Whether the two cannot both be honoured.
     */
    public boolean contradicts(ActionKind other) {
        return permissive != other.permissive;
    }

    /**
     * Whether any action of one set contradicts any action of the other.
     *
     * @param as The first set of actions.
     * @param bs The second set of actions.
     * @return Whether the two sets cannot both be honoured.
     */
    public static boolean anyContradict(Collection<ActionKind> as, Collection<ActionKind> bs) {
        for (ActionKind a : as) {
            for (ActionKind b : bs) {
                if (a.contradicts(b)) return true;
            }
        }
        return false;
    }
}
