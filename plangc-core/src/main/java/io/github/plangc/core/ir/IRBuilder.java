package io.github.plangc.core.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A cursor for appending instructions to a {@link Function}, drawing IDs and
 * block names from its {@link Module}.
 * <p>
 * Anything appended after the current block is terminated goes into a fresh
 * block that nothing jumps to, so that it stays in the IR (and can be reported
 * or preserved) without breaking the single-terminator invariant.
 */
public final class IRBuilder {
    private final Module module;
    private final Function func;
    private BasicBlock block;

    public IRBuilder(@NotNull Module module, @NotNull Function func, @NotNull BasicBlock block) {
        this.module = module;
        this.func = func;
        this.block = block;
    }

    public Module getModule() {
        return module;
    }

    public Function getFunction() {
        return func;
    }

    public BasicBlock getBlock() {
        return block;
    }

    /**
     * Move the cursor to the end of another block.
     *
     * @param block The block.
     */
    public void setBlock(@NotNull BasicBlock block) {
        this.block = block;
    }

    /**
     * Create a new block in the function, without moving the cursor.
     *
     * @param prefix The role of the block, used as the prefix of its name.
     * @return The new block.
     */
    public BasicBlock newBlock(String prefix) {
        return func.newBlock(module.newBlockName(prefix));
    }

    /**
     * Append an instruction at the cursor.
     *
     * @param insn The instruction.
     * @return Its ID.
     */
    public int insert(Insn insn) {
        if (block.isTerminated()) {
            block = newBlock("dead");
        }
        block.add(insn);
        return insn.id;
    }

    public int loadConst(@Nullable Object value) {
        return insert(new LoadConst(module.newInsnId(), value));
    }

    public int loadVar(String name) {
        return insert(new LoadVar(module.newInsnId(), name));
    }

    public int binaryOp(String op, int lhs, int rhs) {
        return insert(new BinaryOp(module.newInsnId(), op, lhs, rhs));
    }

    public int compare(String op, int lhs, int rhs) {
        return insert(new Compare(module.newInsnId(), op, lhs, rhs));
    }

    public int unaryOp(String op, int operand) {
        return insert(new UnaryOp(module.newInsnId(), op, operand));
    }

    public int call(String target, List<Integer> args) {
        return insert(new Call(module.newInsnId(), target, args));
    }

    public void jump(BasicBlock target) {
        insert(new Jump(module.newInsnId(), target.name));
    }

    public void condJump(int cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        insert(new CondJump(module.newInsnId(), cond, ifTrue.name, ifFalse.name));
    }

    public void ret(@Nullable Integer value) {
        insert(new Return(module.newInsnId(), value));
    }

    public void action(ActionKind kind, @Nullable String target, boolean synthesized) {
        insert(new Action(module.newInsnId(), kind, target, func.governance, synthesized));
    }

    public void emitIntent(ActionKind type, List<Integer> payload, boolean requiresConfirmation) {
        insert(new EmitIntent(module.newInsnId(), type, payload,
                func.governance.getPriority(), requiresConfirmation, func.governance));
    }
}
