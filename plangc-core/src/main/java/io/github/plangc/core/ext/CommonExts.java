package io.github.plangc.core.ext;

import io.github.plangc.core.diag.Diagnostic;
import io.github.plangc.core.ir.ActionKind;
import io.github.plangc.core.ir.BasicBlock;
import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.convert.AstToIr;
import io.github.plangc.core.passes.meta.ComputeSignatures;
import io.github.plangc.core.passes.opts.ConstantFolder;
import io.github.plangc.core.passes.opts.EliminateDeadBlocks;
import io.github.plangc.core.passes.opts.MergeCandidate;
import io.github.plangc.core.passes.opts.PolicySimplifier;
import io.github.plangc.core.resolve.ConflictResolver;
import io.github.plangc.core.symbols.SymbolTable;

import java.util.List;
import java.util.Set;

/**
 * The {@link Ext}s attached to IR by the passes of this project.
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. The module the function belongs to.
     */
    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");

    /**
     * Attached to a {@link Module} by {@link AstToIr}. The symbol table built alongside it.
     */
    public static final Ext<SymbolTable> SYMBOL_TABLE = Ext.create(SymbolTable.class, "SYMBOL_TABLE");
    /**
     * Attached to a {@link Module} by {@link AstToIr}. The diagnostics found while building it.
     */
    public static final Ext<List<Diagnostic>> DIAGNOSTICS = Ext.create(List.class, "DIAGNOSTICS");

    /**
     * Attached to a {@link Function} by {@link ConstantFolder}.
     * The number of instructions folded by the last run.
     */
    public static final Ext<Integer> FOLDED_COUNT = Ext.create(Integer.class, "FOLDED_COUNT");
    /**
     * Attached to a {@link Function} by {@link EliminateDeadBlocks}.
     * The number of unreachable blocks deleted by the last run.
     */
    public static final Ext<Integer> ELIMINATED_BLOCKS = Ext.create(Integer.class, "ELIMINATED_BLOCKS");
    /**
     * Attached to a {@link Function} by {@link EliminateDeadBlocks}.
     * The number of unreachable blocks kept by the last run because they hold audit-critical instructions.
     */
    public static final Ext<Integer> RETAINED_BLOCKS = Ext.create(Integer.class, "RETAINED_BLOCKS");
    /**
     * Attached to a {@link BasicBlock} by {@link EliminateDeadBlocks}.
     * Present if the block is unreachable, but kept as audit evidence.
     */
    public static final Ext<Boolean> AUDIT_RETAINED = Ext.create(Boolean.class, "AUDIT_RETAINED");

    /**
     * Attached to a {@link Function}, computed by {@link ComputeSignatures}.
     * The structural signature of the conditions guarding the function's actions.
     * <p>
     * Removed by any pass that rewrites the function.
     */
    public static final Ext<String> CONDITION_SIGNATURE = Ext.create(String.class, "CONDITION_SIGNATURE");
    /**
     * Attached to a {@link Function}, computed by {@link ComputeSignatures}.
     * The kinds of action the function can decide on.
     * <p>
     * Removed by any pass that rewrites the function.
     */
    public static final Ext<Set<ActionKind>> TERMINAL_ACTIONS = Ext.create(Set.class, "TERMINAL_ACTIONS");

    /**
     * Attached to a {@link Module} by {@link PolicySimplifier}. Pairs of policies which could be merged.
     */
    public static final Ext<List<MergeCandidate>> MERGE_CANDIDATES = Ext.create(List.class, "MERGE_CANDIDATES");

    /**
     * Attached to a {@link Function} by {@link ConflictResolver}.
     * The policies whose actions are authoritative over this one's, for the conflicts it lost.
     */
    public static final Ext<Set<String>> OVERRIDDEN_BY = Ext.create(Set.class, "OVERRIDDEN_BY");

    /**
     * Mark a function as rewritten, dropping everything derived from its old shape.
     *
     * @param function The function.
     */
    public static void functionChanged(Function function) {
        function.removeExt(CONDITION_SIGNATURE);
        function.removeExt(TERMINAL_ACTIONS);
    }
}
