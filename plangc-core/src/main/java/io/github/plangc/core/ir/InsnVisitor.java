package io.github.plangc.core.ir;

/**
 * A visitor over every kind of {@link Insn}.
 *
 * @param <R> The result type.
 */
public interface InsnVisitor<R> {
    R visitLoadConst(LoadConst insn);

    R visitLoadVar(LoadVar insn);

    R visitBinaryOp(BinaryOp insn);

    R visitUnaryOp(UnaryOp insn);

    R visitCompare(Compare insn);

    R visitCall(Call insn);

    R visitJump(Jump insn);

    R visitCondJump(CondJump insn);

    R visitReturn(Return insn);

    R visitAction(Action insn);

    R visitEmitIntent(EmitIntent insn);
}
