package io.github.plangc.api;

import io.github.plangc.api.events.*;
import io.github.plangc.core.ast.ProgramNode;
import io.github.plangc.core.diag.Diagnostic;
import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.Passes;
import io.github.plangc.core.passes.convert.AstToIr;
import io.github.plangc.core.passes.meta.VerifyIR;
import io.github.plangc.core.passes.opts.ConstantFolder;
import io.github.plangc.core.passes.opts.MergeCandidate;
import io.github.plangc.core.resolve.Conflict;
import io.github.plangc.core.resolve.ConflictResolver;
import io.github.plangc.core.resolve.Resolution;
import io.github.plangc.core.schedule.DagSorter;
import io.github.plangc.core.schedule.ExecutionPlan;
import io.github.plangc.core.util.IRPrinter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Represents the compilation of a single (already parsed) PLang program.
 * <p>
 * Compilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunCompilationEvent} is fired on the {@link PolicyCompiler compiler}.</li>
 *     <li>The program is {@link AstToIr lowered to IR}.</li>
 *     <li>{@link IrBuiltEvent} is fired.</li>
 *     <li>The IR is {@link Passes#OPTIMIZE optimised}, unless disabled.</li>
 *     <li>{@link OptimizedEvent} is fired.</li>
 *     <li>Conflicts between policies are {@link ConflictResolver resolved}.</li>
 *     <li>{@link ResolvedEvent} is fired.</li>
 *     <li>The policies are {@link DagSorter scheduled}.</li>
 *     <li>{@link ScheduledEvent} is fired.</li>
 * </ol>
 * If verification is enabled, the IR is {@link VerifyIR verified} after each of the
 * first two steps that produce it, and after listeners have had their turn.
 */
public class PolicyCompilation extends EventSupplier<ModuleCompileEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(PolicyCompilation.class);

    private final PolicyCompiler cc;

    /**
     * The program being compiled.
     */
    @NotNull
    public ProgramNode program;

    /**
     * Construct a new compilation in the given compiler for the given program.
     *
     * @param cc      The compiler.
     * @param program The program being compiled.
     */
    PolicyCompilation(PolicyCompiler cc, @NotNull ProgramNode program) {
        this.cc = cc;
        this.program = program;
    }

    /**
     * Run the compilation.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The result.
     * @throws io.github.plangc.core.diag.CompileException If the program cannot be compiled.
     */
    public CompilationResult run() {
        CompilerOptions options = cc.getOptions();
        cc.dispatch(RunCompilationEvent.class, new RunCompilationEvent(this));
        LOG.debug("Compiling {} with {}", options.getModuleName(), options);

        Module module = new AstToIr(options.getModuleName()).run(program);
        module = dispatch(IrBuiltEvent.class, new IrBuiltEvent(module)).module;
        verify(options, module);

        if (options.isOptimize()) {
            Passes.OPTIMIZE.run(module);
            LOG.debug("Folded {} instructions in {}", ConstantFolder.foldedCount(module), module.name);
        }
        module = dispatch(OptimizedEvent.class, new OptimizedEvent(module, options.isOptimize())).module;
        verify(options, module);

        Resolution resolution = ConflictResolver.INSTANCE.run(module);
        dispatch(ResolvedEvent.class, new ResolvedEvent(resolution));

        DagSorter sorter = new DagSorter();
        sorter.buildDag(module);
        ExecutionPlan plan = sorter.sort();
        dispatch(ScheduledEvent.class, new ScheduledEvent(plan, sorter.visualize()));

        List<Diagnostic> diagnostics = module.getExtOr(CommonExts.DIAGNOSTICS, Collections.emptyList());
        for (Diagnostic diagnostic : diagnostics) {
            LOG.info("{}", diagnostic);
        }
        for (Conflict conflict : resolution.conflicts) {
            LOG.info("{}", conflict);
        }
        List<MergeCandidate> mergeCandidates = module.getExtOr(CommonExts.MERGE_CANDIDATES, Collections.emptyList());
        if (options.isDumpIr()) {
            LOG.info("IR of {}:\n{}", module.name, IRPrinter.print(module));
        }

        String fingerprint = IRPrinter.fingerprint(module);
        LOG.debug("Compiled {}: {} policies, fingerprint {}", module.name, plan.totalPolicies, fingerprint);
        return new CompilationResult(
                module,
                plan,
                resolution.conflicts,
                diagnostics,
                mergeCandidates,
                fingerprint);
    }

    private static void verify(CompilerOptions options, Module module) {
        if (options.isVerify()) {
            VerifyIR.INSTANCE.run(module);
        }
    }
}
