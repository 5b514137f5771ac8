package io.github.plangc.test;

import io.github.plangc.core.ast.*;
import io.github.plangc.core.ir.*;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.convert.AstToIr;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class Utils {
    public static final String FILE = "test.plang";

    private static int line = 0;

    // distinct lines make the locations in failures readable
    public static synchronized SourceLocation loc() {
        return new SourceLocation(FILE, ++line, 1);
    }

    public static ProgramNode program(StmtNode... statements) {
        return new ProgramNode(loc(), Arrays.asList(statements));
    }

    public static ImportNode importOf(String path) {
        return new ImportNode(loc(), path);
    }

    public static PolicyDeclNode policy(String name, @Nullable Category category, StmtNode... body) {
        return new PolicyDeclNode(loc(), name, category, null, Arrays.asList(body));
    }

    public static PolicyDeclNode policy(
            String name,
            @Nullable Category category,
            int priority,
            int auditLevel,
            StmtNode... body
    ) {
        return new PolicyDeclNode(loc(), name, category, new GovernanceNode(loc(), priority, auditLevel),
                Arrays.asList(body));
    }

    public static RuleDeclNode rule(String name, StmtNode... body) {
        return new RuleDeclNode(loc(), name, null, null, Arrays.asList(body));
    }

    public static RuleDeclNode rule(String name, @Nullable Category category, int priority, int auditLevel,
                                    StmtNode... body) {
        return new RuleDeclNode(loc(), name, category, new GovernanceNode(loc(), priority, auditLevel),
                Arrays.asList(body));
    }

    public static ConditionBlockNode when(ExprNode condition, StmtNode action) {
        return new ConditionBlockNode(loc(), condition, action);
    }

    public static ActionBlockNode allow() {
        return new ActionBlockNode(loc(), ActionKind.ALLOW);
    }

    public static ActionBlockNode deny() {
        return new ActionBlockNode(loc(), ActionKind.DENY);
    }

    public static ActionBlockNode escalate(@Nullable String target) {
        return new ActionBlockNode(loc(), ActionKind.ESCALATE, target);
    }

    public static RouteTargetNode route(String target) {
        return new RouteTargetNode(loc(), target);
    }

    public static RuleRefNode ref(String name) {
        return new RuleRefNode(loc(), name);
    }

    public static PriorityNode priority(int value) {
        return new PriorityNode(loc(), value);
    }

    public static BinaryOpNode bin(String op, ExprNode left, ExprNode right) {
        return new BinaryOpNode(loc(), op, left, right);
    }

    public static UnaryOpNode un(String op, ExprNode operand) {
        return new UnaryOpNode(loc(), op, operand);
    }

    public static IdentNode ident(String name) {
        return new IdentNode(loc(), name);
    }

    public static LiteralNode lit(@Nullable Object value) {
        return new LiteralNode(loc(), value);
    }

    public static FuncCallNode call(String name, ExprNode... args) {
        return new FuncCallNode(loc(), name, Arrays.asList(args));
    }

    public static AttrAccessNode attr(ExprNode object, String attr) {
        return new AttrAccessNode(loc(), object, attr);
    }

    @NotNull
    public static Module build(ProgramNode program) {
        return AstToIr.INSTANCE.run(program);
    }

    public static List<Insn> insns(Function function) {
        List<Insn> all = new ArrayList<>();
        for (BasicBlock block : function.getBlocks()) {
            all.addAll(block.getInsns());
        }
        return all;
    }

    public static <T extends Insn> List<T> insnsOf(Function function, Class<T> kind) {
        List<T> found = new ArrayList<>();
        for (Insn insn : insns(function)) {
            if (kind.isInstance(insn)) found.add(kind.cast(insn));
        }
        return found;
    }

    public static BasicBlock blockWithPrefix(Function function, String prefix) {
        for (BasicBlock block : function.getBlocks()) {
            if (block.name.startsWith(prefix + ".")) return block;
        }
        throw new AssertionError("no block " + prefix + ".* in " + function.name);
    }
}
