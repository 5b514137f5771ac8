package io.github.plangc.core.passes.opts;

import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.BasicBlock;
import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.Insn;
import io.github.plangc.core.passes.InPlaceIRPass;
import io.github.plangc.core.util.BlockGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * An optimisation pass that removes any blocks unreachable from the entry block.
 * <p>
 * Unreachable blocks holding an audit-critical instruction are kept whole and marked
 * {@link CommonExts#AUDIT_RETAINED}, since audit evidence must never be deleted.
 */
public class EliminateDeadBlocks implements InPlaceIRPass<Function> {
    private static final Logger LOG = LoggerFactory.getLogger(EliminateDeadBlocks.class);

    /**
     * An instance of this pass.
     */
    public static final EliminateDeadBlocks INSTANCE = new EliminateDeadBlocks();

    @Override
    public void runInPlace(Function function) {
        Set<BasicBlock> reachable = BlockGraph.reachable(function);
        int eliminated = 0;
        int retained = 0;
        for (String name : function.getBlockNames()) {
            BasicBlock block = function.getBlockOrThrow(name);
            if (reachable.contains(block)) continue;
            if (holdsAuditEvidence(block)) {
                block.attachExt(CommonExts.AUDIT_RETAINED, true);
                retained++;
            } else {
                function.removeBlock(name);
                eliminated++;
            }
        }
        function.attachExt(CommonExts.ELIMINATED_BLOCKS, eliminated);
        function.attachExt(CommonExts.RETAINED_BLOCKS, retained);
        if (eliminated > 0) {
            LOG.debug("Eliminated {} unreachable blocks from {}", eliminated, function.name);
            CommonExts.functionChanged(function);
        }
        if (retained > 0) {
            LOG.debug("Kept {} unreachable blocks in {} for audit", retained, function.name);
        }
    }

    private static boolean holdsAuditEvidence(BasicBlock block) {
        for (Insn insn : block.getInsns()) {
            if (insn.isAuditCritical()) return true;
        }
        return false;
    }
}
