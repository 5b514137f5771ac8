package io.github.plangc.core.ir;

import io.github.plangc.core.ext.ExtHolder;
import io.github.plangc.core.util.IRPrinter;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * An IR instruction.
 * <p>
 * Every instruction has an ID, unique within its {@link Module} and never reused,
 * by which other instructions refer to its result. The set of instruction kinds
 * is closed; dispatch through {@link #accept(InsnVisitor)}.
 */
public abstract class Insn extends ExtHolder {
    /**
     * The ID of this instruction, and of the value it produces.
     */
    public final int id;

    protected Insn(int id) {
        this.id = id;
    }

    /**
     * Dispatch on the kind of this instruction.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visit method for this kind.
     */
    public abstract <R> R accept(InsnVisitor<R> visitor);

    /**
     * Get the IDs of the values this instruction reads, in evaluation order.
     *
     * @return The operand IDs.
     */
    public List<Integer> operands() {
        return Collections.emptyList();
    }

    /**
     * Rewrite every operand ID of this instruction.
     *
     * @param remap The function from old to new operand IDs.
     */
    public void remapOperands(IntUnaryOperator remap) {
    }

    /**
     * Whether this instruction ends its block.
     *
     * @return Whether this is a control transfer.
     */
    public boolean isTerminator() {
        return false;
    }

    /**
     * Get the names of the blocks control may transfer to after this instruction.
     *
     * @return The jump targets, empty if this does not jump.
     */
    public List<String> targets() {
        return Collections.emptyList();
    }

    /**
     * Get the governance metadata this instruction acts under, if any.
     *
     * @return The metadata, or null for plain computation.
     */
    @Nullable
    public GovernanceMetadata getGovernance() {
        return null;
    }

    /**
     * Whether this instruction is evidence of a governance-critical decision,
     * and so must never be removed by optimisation.
     *
     * @return Whether its governance audit level is above zero.
     */
    public final boolean isAuditCritical() {
        GovernanceMetadata governance = getGovernance();
        return governance != null && governance.isAuditCritical();
    }

    @Override
    public String toString() {
        return IRPrinter.render(this);
    }
}
