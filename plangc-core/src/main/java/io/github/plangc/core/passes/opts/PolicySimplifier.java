package io.github.plangc.core.passes.opts;

import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.ActionKind;
import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.InPlaceIRPass;
import io.github.plangc.core.passes.meta.ComputeSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An analysis pass that finds policies which could be merged.
 * <p>
 * Two policies are candidates if they share a category and none of the actions
 * either can decide on {@link ActionKind#contradicts(ActionKind) contradicts} the
 * other's. The module is not rewritten; the candidates are attached as
 * {@link CommonExts#MERGE_CANDIDATES}, in declaration order.
 */
public class PolicySimplifier implements InPlaceIRPass<Module> {
    private static final Logger LOG = LoggerFactory.getLogger(PolicySimplifier.class);

    /**
     * An instance of this pass.
     */
    public static final PolicySimplifier INSTANCE = new PolicySimplifier();

    @Override
    public void runInPlace(Module module) {
        List<Function> policies = module.getPolicies();
        List<MergeCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < policies.size(); i++) {
            Function a = policies.get(i);
            for (int j = i + 1; j < policies.size(); j++) {
                Function b = policies.get(j);
                if (a.governance.getCategory() != b.governance.getCategory()) continue;
                if (ActionKind.anyContradict(ComputeSignatures.terminalActionsOf(a), ComputeSignatures.terminalActionsOf(b))) {
                    continue;
                }
                candidates.add(new MergeCandidate(a.name, b.name, a.governance.getCategory()));
            }
        }
        LOG.debug("Found {} merge candidates in {}", candidates.size(), module.name);
        module.attachExt(CommonExts.MERGE_CANDIDATES, Collections.unmodifiableList(candidates));
    }
}
