package io.github.plangc.core.ast;

/**
 * A visitor over every kind of {@link StmtNode}.
 *
 * @param <R> The result type.
 */
public interface StmtVisitor<R> {
    R visitImport(ImportNode node);

    R visitPolicyDecl(PolicyDeclNode node);

    R visitRuleDecl(RuleDeclNode node);

    R visitConditionBlock(ConditionBlockNode node);

    R visitActionBlock(ActionBlockNode node);

    R visitRouteTarget(RouteTargetNode node);

    R visitRuleRef(RuleRefNode node);

    R visitPriority(PriorityNode node);
}
