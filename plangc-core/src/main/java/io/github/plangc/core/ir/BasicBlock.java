package io.github.plangc.core.ir;

import io.github.plangc.core.ext.ExtHolder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block: a straight-line sequence of {@link Insn instructions}
 * which, once complete, ends in exactly one terminator.
 */
public final class BasicBlock extends ExtHolder {
    /**
     * The name of this block, unique within its module.
     */
    @NotNull
    public final String name;
    private final List<Insn> insns = new ArrayList<>();

    BasicBlock(@NotNull String name) {
        this.name = name;
    }

    /**
     * Get the instructions of this block.
     * <p>
     * The list is mutable, for passes which rewrite or delete instructions.
     *
     * @return The list of instructions.
     */
    public List<Insn> getInsns() {
        return insns;
    }

    /**
     * Append an instruction to this block.
     *
     * @param insn The instruction.
     * @throws IllegalStateException If the block is already terminated.
     */
    public void add(Insn insn) {
        if (isTerminated()) {
            throw new IllegalStateException("Block " + name + " is already terminated by " + getTerminator());
        }
        insns.add(insn);
    }

    public boolean isEmpty() {
        return insns.isEmpty();
    }

    /**
     * Whether this block ends in a control transfer.
     *
     * @return Whether the last instruction is a terminator.
     */
    public boolean isTerminated() {
        return getTerminator() != null;
    }

    /**
     * Get the instruction ending this block.
     *
     * @return The terminator, or null if the block is not terminated.
     */
    @Nullable
    public Insn getTerminator() {
        if (insns.isEmpty()) return null;
        Insn last = insns.get(insns.size() - 1);
        return last.isTerminator() ? last : null;
    }

    /**
     * Get the names of the blocks control may pass to from this block.
     *
     * @return The successor names.
     */
    public List<String> successors() {
        Insn terminator = getTerminator();
        return terminator == null ? Collections.emptyList() : terminator.targets();
    }

    @Override
    public String toString() {
        return name;
    }
}
