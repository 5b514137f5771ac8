package io.github.plangc.core.resolve;

import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.ActionKind;
import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.GovernanceMetadata;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.ir.Precedence;
import io.github.plangc.core.passes.IRPass;
import io.github.plangc.core.passes.meta.ComputeSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds conflicting pairs of top-level policies and decides which of each pair is authoritative.
 * <p>
 * Pairs are examined in declaration order. Two policies are in an
 * {@link ConflictType#ACTION ACTION} conflict if their condition signatures are equal
 * and their terminal actions {@link ActionKind#anyContradict contradict}, and in a
 * {@link ConflictType#PRIORITY PRIORITY} conflict if they share both category and priority.
 * A pair may conflict both ways, ACTION reported first.
 * <p>
 * The winner is chosen by {@link Precedence}. No policy is removed; each loser is
 * marked with {@link CommonExts#OVERRIDDEN_BY} instead.
 */
public class ConflictResolver implements IRPass<Module, Resolution> {
    private static final Logger LOG = LoggerFactory.getLogger(ConflictResolver.class);

    /**
     * An instance of this pass.
     */
    public static final ConflictResolver INSTANCE = new ConflictResolver();

    @Override
    public Resolution run(Module module) {
        List<Function> policies = module.getPolicies();
        for (Function policy : policies) {
            policy.removeExt(CommonExts.OVERRIDDEN_BY);
        }

        List<Conflict> conflicts = new ArrayList<>();
        for (int i = 0; i < policies.size(); i++) {
            Function a = policies.get(i);
            for (int j = i + 1; j < policies.size(); j++) {
                Function b = policies.get(j);
                if (ComputeSignatures.signatureOf(a).equals(ComputeSignatures.signatureOf(b))
                        && ActionKind.anyContradict(
                        ComputeSignatures.terminalActionsOf(a), ComputeSignatures.terminalActionsOf(b))) {
                    conflicts.add(resolve(ConflictType.ACTION, a, b));
                }
                GovernanceMetadata ga = a.governance;
                GovernanceMetadata gb = b.governance;
                if (ga.getCategory() == gb.getCategory() && ga.getPriority() == gb.getPriority()) {
                    conflicts.add(resolve(ConflictType.PRIORITY, a, b));
                }
            }
        }

        for (Conflict conflict : conflicts) {
            Function loser = module.getFunction(conflict.getLoser());
            if (loser == null) continue;
            Set<String> overriddenBy = loser.getNullable(CommonExts.OVERRIDDEN_BY);
            if (overriddenBy == null) {
                overriddenBy = new LinkedHashSet<>();
                loser.attachExt(CommonExts.OVERRIDDEN_BY, overriddenBy);
            }
            overriddenBy.add(conflict.winner);
        }
        LOG.debug("Found {} conflicts in {}", conflicts.size(), module.name);
        return new Resolution(module, conflicts);
    }

    private static Conflict resolve(ConflictType type, Function a, Function b) {
        Function winner = Precedence.winner(a, b);
        Function loser = winner == a ? b : a;
        return new Conflict(type, a.name, b.name, winner.name, Precedence.explain(winner, loser));
    }
}
