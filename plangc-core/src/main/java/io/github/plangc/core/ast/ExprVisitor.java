package io.github.plangc.core.ast;

/**
 * A visitor over every kind of {@link ExprNode}.
 *
 * @param <R> The result type.
 */
public interface ExprVisitor<R> {
    R visitBinaryOp(BinaryOpNode node);

    R visitUnaryOp(UnaryOpNode node);

    R visitIdent(IdentNode node);

    R visitLiteral(LiteralNode node);

    R visitFuncCall(FuncCallNode node);

    R visitAttrAccess(AttrAccessNode node);
}
