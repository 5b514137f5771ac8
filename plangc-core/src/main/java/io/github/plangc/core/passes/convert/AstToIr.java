package io.github.plangc.core.passes.convert;

import io.github.plangc.core.ast.*;
import io.github.plangc.core.diag.CompileException;
import io.github.plangc.core.diag.Diagnostic;
import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.*;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.IRPass;
import io.github.plangc.core.symbols.Symbol;
import io.github.plangc.core.symbols.SymbolKind;
import io.github.plangc.core.symbols.SymbolTable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Lowers a parsed PLang program into an IR {@link Module}.
 * <p>
 * Each top-level policy becomes a function, and each rule a nested function named
 * {@code policy.rule}. A body compiles into an entry block; when it falls off the end
 * without deciding, an implicit ALLOW is appended. A {@code when} block always
 * lowers to the same shape: a conditional jump to a {@code then} and an {@code else}
 * block, both continuing at a {@code merge} block, where compilation carries on.
 * <p>
 * Every call to {@link #run(ProgramNode)} builds a fresh module and symbol table,
 * so one instance may be used for any number of concurrent builds.
 * <p>
 * Unresolved rule references and misplaced statements are recorded as
 * {@link CommonExts#DIAGNOSTICS diagnostics} on the module; duplicate declarations
 * and unbalanced scopes abort the build with a {@link CompileException}.
 */
public class AstToIr implements IRPass<ProgramNode, Module> {
    private static final Logger LOG = LoggerFactory.getLogger(AstToIr.class);

    /**
     * The name given to modules when none is specified.
     */
    public static final String DEFAULT_MODULE_NAME = "main";
    /**
     * An instance which names its modules {@value #DEFAULT_MODULE_NAME}.
     */
    public static final AstToIr INSTANCE = new AstToIr(DEFAULT_MODULE_NAME);

    /**
     * Operators which lower to {@link Compare} rather than {@link BinaryOp}.
     */
    public static final Set<String> COMPARE_OPS = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("<", "<=", ">", ">=", "==", "!=")));
    /**
     * The builtin called for attribute access on something other than a variable path.
     */
    public static final String ATTR_BUILTIN = "attr";

    private final String moduleName;

    /**
     * Construct a builder producing modules with the given name.
     *
     * @param moduleName The module name.
     */
    public AstToIr(@NotNull String moduleName) {
        this.moduleName = moduleName;
    }

    @Override
    public Module run(ProgramNode program) {
        Module module = new Build().build(program);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Built module {}: {} functions, {} diagnostics",
                    module.name,
                    module.getFunctions().size(),
                    module.getExtOrThrow(CommonExts.DIAGNOSTICS).size());
        }
        return module;
    }

    /**
     * Normalize the spelling of an operator.
     *
     * @param op The operator as written.
     * @return The canonical operator.
     */
    public static String normalizeOp(String op) {
        switch (op) {
            case "&&":
            case "AND":
                return "and";
            case "||":
            case "OR":
                return "or";
            case "!":
            case "NOT":
                return "not";
            default:
                return op;
        }
    }

    /**
     * The state of a single build. Nothing here outlives the call to {@link #build(ProgramNode)}.
     */
    private class Build implements StmtVisitor<Void>, ExprVisitor<Integer> {
        private final Module module = new Module(moduleName);
        private final SymbolTable symbols = new SymbolTable();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private int declarationIndex = 0;
        /**
         * The insertion point in the function being built, null at the top level.
         */
        @Nullable
        private IRBuilder ib;

        Module build(ProgramNode program) {
            for (StmtNode stmt : program.statements) {
                if (stmt instanceof ImportNode) {
                    module.imports.add(((ImportNode) stmt).path);
                }
            }
            for (StmtNode stmt : program.statements) {
                if (stmt instanceof ImportNode) continue;
                stmt.accept(this);
            }
            symbols.checkBalanced(program.location);
            for (Symbol rule : symbols.unreferencedRules()) {
                diagnostics.add(new Diagnostic(
                        Diagnostic.Kind.UNREFERENCED_RULE,
                        "rule '" + rule.qualifiedName + "' is declared but never referenced",
                        rule.location));
            }
            module.attachExt(CommonExts.SYMBOL_TABLE, symbols);
            module.attachExt(CommonExts.DIAGNOSTICS, Collections.unmodifiableList(diagnostics));
            return module;
        }

        private IRBuilder ib() {
            if (ib == null) {
                throw new IllegalStateException("no function is being built");
            }
            return ib;
        }

        private GovernanceMetadata governanceFor(DeclNode decl, @Nullable GovernanceMetadata enclosing) {
            Category category = decl.category != null ? decl.category
                    : enclosing != null ? enclosing.getCategory()
                    : Category.CUSTOM;
            int priority = decl.governance != null ? decl.governance.priority
                    : enclosing != null ? enclosing.getPriority()
                    : 0;
            int auditLevel = decl.governance != null ? decl.governance.auditLevel
                    : enclosing != null ? enclosing.getAuditLevel()
                    : 0;
            return new GovernanceMetadata(category, priority, auditLevel);
        }

        private void misplaced(StmtNode stmt, String what) {
            diagnostics.add(new Diagnostic(Diagnostic.Kind.MISPLACED_STATEMENT, what, stmt.location));
        }

        private void compileDecl(DeclNode decl, SymbolKind kind) {
            Function enclosing = ib == null ? null : ib.getFunction();
            String qualifiedName = enclosing == null ? decl.name : enclosing.name + "." + decl.name;
            GovernanceMetadata governance = governanceFor(decl, enclosing == null ? null : enclosing.governance);
            if (kind == SymbolKind.POLICY) {
                symbols.define(new Symbol(decl.name, qualifiedName, kind,
                        governance.getCategory(), governance.getPriority(), decl.location));
            }

            Function func = new Function(
                    qualifiedName,
                    kind,
                    enclosing == null ? null : enclosing.name,
                    governance,
                    declarationIndex++,
                    decl.location);
            try {
                module.addFunction(func);
            } catch (IllegalArgumentException e) {
                throw new CompileException("function name '" + qualifiedName + "' is already taken", decl.location);
            }

            IRBuilder saved = ib;
            ib = new IRBuilder(module, func, func.newBlock("entry"));
            symbols.enterScope(qualifiedName, governance.getCategory());
            for (StmtNode stmt : decl.body) {
                if (stmt instanceof RuleDeclNode) {
                    RuleDeclNode rule = (RuleDeclNode) stmt;
                    GovernanceMetadata ruleGov = governanceFor(rule, governance);
                    symbols.define(new Symbol(rule.name, qualifiedName + "." + rule.name, SymbolKind.RULE,
                            ruleGov.getCategory(), ruleGov.getPriority(), rule.location));
                }
            }
            for (StmtNode stmt : decl.body) {
                stmt.accept(this);
            }
            if (!ib.getBlock().isTerminated()) {
                ib.action(ActionKind.ALLOW, null, true);
            }
            symbols.exitScope();
            ib = saved;
        }

        @Override
        public Void visitImport(ImportNode node) {
            misplaced(node, "import of '" + node.path + "' inside a declaration body is ignored");
            return null;
        }

        @Override
        public Void visitPolicyDecl(PolicyDeclNode node) {
            if (ib != null) {
                misplaced(node, "policy '" + node.name + "' nested in '" + ib.getFunction().name + "' is ignored");
                return null;
            }
            compileDecl(node, SymbolKind.POLICY);
            return null;
        }

        @Override
        public Void visitRuleDecl(RuleDeclNode node) {
            if (ib == null) {
                misplaced(node, "rule '" + node.name + "' outside of any policy is ignored");
                return null;
            }
            compileDecl(node, SymbolKind.RULE);
            return null;
        }

        @Override
        public Void visitConditionBlock(ConditionBlockNode node) {
            if (ib == null) {
                misplaced(node, "condition outside of any policy is ignored");
                return null;
            }
            int cond = node.condition.accept(this);
            IRBuilder ib = ib();
            BasicBlock thenBlock = ib.newBlock("then");
            BasicBlock elseBlock = ib.newBlock("else");
            BasicBlock mergeBlock = ib.newBlock("merge");
            ib.condJump(cond, thenBlock, elseBlock);

            ib.setBlock(thenBlock);
            node.action.accept(this);
            if (!ib.getBlock().isTerminated()) {
                ib.jump(mergeBlock);
            }

            ib.setBlock(elseBlock);
            ib.jump(mergeBlock);

            ib.setBlock(mergeBlock);
            return null;
        }

        private void compileAction(StmtNode node, ActionKind kind, @Nullable String target) {
            if (ib == null) {
                misplaced(node, "action " + kind + " outside of any policy is ignored");
                return;
            }
            if (kind.emitsIntent()) {
                List<Integer> payload = target == null
                        ? Collections.emptyList()
                        : Collections.singletonList(ib.loadConst(target));
                ib.emitIntent(kind, payload, kind == ActionKind.ESCALATE);
            }
            ib.action(kind, target, false);
        }

        @Override
        public Void visitActionBlock(ActionBlockNode node) {
            compileAction(node, node.action, node.target);
            return null;
        }

        @Override
        public Void visitRouteTarget(RouteTargetNode node) {
            compileAction(node, ActionKind.ROUTE, node.target);
            return null;
        }

        @Override
        public Void visitRuleRef(RuleRefNode node) {
            if (ib == null) {
                misplaced(node, "reference to rule '" + node.name + "' outside of any policy is ignored");
                return null;
            }
            String from = ib.getFunction().name;
            Symbol symbol = symbols.addReference(node.name, from);
            String target;
            if (symbol != null && symbol.kind == SymbolKind.RULE) {
                target = symbol.qualifiedName;
            } else {
                diagnostics.add(new Diagnostic(
                        Diagnostic.Kind.UNRESOLVED_RULE,
                        symbol == null
                                ? "no rule '" + node.name + "' is visible from '" + from + "'"
                                : "'" + node.name + "' names a policy, not a rule",
                        node.location));
                target = node.name;
            }
            int ctx = ib.loadVar(Function.CONTEXT_PARAM);
            ib.call(target, Collections.singletonList(ctx));
            return null;
        }

        @Override
        public Void visitPriority(PriorityNode node) {
            if (ib == null) {
                misplaced(node, "priority directive outside of any policy is ignored");
                return null;
            }
            ib.getFunction().governance.setPriority(node.value);
            symbols.setCurrentPriority(node.value);
            return null;
        }

        @Override
        public Integer visitBinaryOp(BinaryOpNode node) {
            // left is fully evaluated before right is visited
            int lhs = node.left.accept(this);
            int rhs = node.right.accept(this);
            String op = normalizeOp(node.op);
            return COMPARE_OPS.contains(op)
                    ? ib().compare(op, lhs, rhs)
                    : ib().binaryOp(op, lhs, rhs);
        }

        @Override
        public Integer visitUnaryOp(UnaryOpNode node) {
            int operand = node.operand.accept(this);
            return ib().unaryOp(normalizeOp(node.op), operand);
        }

        @Override
        public Integer visitIdent(IdentNode node) {
            return ib().loadVar(node.name);
        }

        @Override
        public Integer visitLiteral(LiteralNode node) {
            return ib().loadConst(node.value);
        }

        @Override
        public Integer visitFuncCall(FuncCallNode node) {
            List<Integer> args = new ArrayList<>();
            for (ExprNode arg : node.args) {
                args.add(arg.accept(this));
            }
            return ib().call(node.name, args);
        }

        @Override
        public Integer visitAttrAccess(AttrAccessNode node) {
            String path = pathOf(node);
            if (path != null) {
                return ib().loadVar(path);
            }
            int object = node.object.accept(this);
            int attr = ib().loadConst(node.attr);
            return ib().call(ATTR_BUILTIN, Arrays.asList(object, attr));
        }

        @Nullable
        private String pathOf(ExprNode node) {
            if (node instanceof IdentNode) {
                return ((IdentNode) node).name;
            }
            if (node instanceof AttrAccessNode) {
                AttrAccessNode attr = (AttrAccessNode) node;
                String base = pathOf(attr.object);
                return base == null ? null : base + "." + attr.attr;
            }
            return null;
        }
    }
}
