package io.github.plangc.api;

import io.github.plangc.core.diag.Diagnostic;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.opts.MergeCandidate;
import io.github.plangc.core.resolve.Conflict;
import io.github.plangc.core.schedule.ExecutionPlan;

import java.util.Collections;
import java.util.List;

/**
 * Everything a finished {@link PolicyCompilation} produced.
 */
public final class CompilationResult {
    /**
     * The optimised and resolved module. Every declared policy is still in it.
     */
    public final Module module;
    public final ExecutionPlan plan;
    /**
     * The conflicts found, in the order the policy pairs were examined.
     */
    public final List<Conflict> conflicts;
    public final List<Diagnostic> diagnostics;
    public final List<MergeCandidate> mergeCandidates;
    /**
     * The SHA-256 of the printed module, identifying this exact IR.
     */
    public final String fingerprint;

    public CompilationResult(
            Module module,
            ExecutionPlan plan,
            List<Conflict> conflicts,
            List<Diagnostic> diagnostics,
            List<MergeCandidate> mergeCandidates,
            String fingerprint
    ) {
        this.module = module;
        this.plan = plan;
        this.conflicts = Collections.unmodifiableList(conflicts);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.mergeCandidates = Collections.unmodifiableList(mergeCandidates);
        this.fingerprint = fingerprint;
    }

    /**
     * Get the names of the policies in the order they execute.
     *
     * @return The execution order.
     */
    public List<String> getExecutionOrder() {
        return plan.flatten();
    }
}
