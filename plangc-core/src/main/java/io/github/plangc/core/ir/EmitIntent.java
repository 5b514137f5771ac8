package io.github.plangc.core.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;
import java.util.function.IntUnaryOperator;

/**
 * {@code emit intentType(%payload...)}: an out-of-band notification to the runtime
 * accompanying a ROUTE or ESCALATE action.
 */
public final class EmitIntent extends Insn {
    @NotNull
    public final ActionKind intentType;
    private final List<Integer> payload;
    private final int priority;
    public final boolean requiresConfirmation;
    @Nullable
    private final GovernanceMetadata governance;

    public EmitIntent(
            int id,
            @NotNull ActionKind intentType,
            @NotNull List<Integer> payload,
            int priority,
            boolean requiresConfirmation,
            @Nullable GovernanceMetadata governance
    ) {
        super(id);
        this.intentType = intentType;
        this.payload = new ArrayList<>(payload);
        this.priority = priority;
        this.requiresConfirmation = requiresConfirmation;
        this.governance = governance;
    }

    /**
     * Get the priority the runtime sees for this intent.
     * <p>
     * This follows the governance of the emitting function, so a priority directive later in
     * the body still applies; the priority given at construction is only used without governance.
     *
     * @return The priority.
     */
    public int getPriority() {
        return governance != null ? governance.getPriority() : priority;
    }

    @Override
    public List<Integer> operands() {
        return Collections.unmodifiableList(payload);
    }

    @Override
    public void remapOperands(IntUnaryOperator remap) {
        ListIterator<Integer> li = payload.listIterator();
        while (li.hasNext()) {
            li.set(remap.applyAsInt(li.next()));
        }
    }

    @Override
    public @Nullable GovernanceMetadata getGovernance() {
        return governance;
    }

    @Override
    public <R> R accept(InsnVisitor<R> visitor) {
        return visitor.visitEmitIntent(this);
    }
}
