package io.github.plangc.core.passes.meta;

import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ir.BasicBlock;
import io.github.plangc.core.ir.Function;
import io.github.plangc.core.ir.Insn;
import io.github.plangc.core.ir.Module;
import io.github.plangc.core.passes.InPlaceIRPass;
import io.github.plangc.core.util.BlockGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A pass which checks the structural validity of a module.
 * <p>
 * In every function, the entry block must exist, no terminator may appear before
 * the end of a block, and every operand must name an instruction of the function.
 * Reachable blocks must additionally be terminated, and jump only to blocks that exist.
 * <p>
 * Violations are collected, then thrown together as an {@link IllegalStateException}.
 */
public class VerifyIR implements InPlaceIRPass<Module> {
    /**
     * A singleton instance of this class.
     */
    public static final VerifyIR INSTANCE = new VerifyIR();

    @Override
    public void runInPlace(Module module) {
        List<String> errors = new ArrayList<>();
        for (Function func : module.getFunctions()) {
            verify(func, errors);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid IR in module " + module.name + ":\n  "
                    + String.join("\n  ", errors));
        }
    }

    private void verify(Function func, List<String> errors) {
        if (func.getEntry() == null || func.getBlock(func.getEntry()) == null) {
            errors.add(func.name + ": missing entry block " + func.getEntry());
            return;
        }
        if (func.getNullable(CommonExts.OWNING_MODULE) == null) {
            errors.add(func.name + ": not owned by a module");
        }

        Set<Integer> defined = new HashSet<>();
        for (BasicBlock block : func.getBlocks()) {
            for (Insn insn : block.getInsns()) {
                if (!defined.add(insn.id)) {
                    errors.add(func.name + "/" + block.name + ": duplicate instruction ID %" + insn.id);
                }
            }
        }

        Set<BasicBlock> reachable = BlockGraph.reachable(func);
        for (BasicBlock block : func.getBlocks()) {
            String where = func.name + "/" + block.name;
            List<Insn> insns = block.getInsns();
            for (int i = 0; i < insns.size(); i++) {
                Insn insn = insns.get(i);
                if (insn.isTerminator() && i != insns.size() - 1) {
                    errors.add(where + ": terminator before the end of the block: " + insn);
                }
                for (int operand : insn.operands()) {
                    if (!defined.contains(operand)) {
                        errors.add(where + ": use of undefined value %" + operand + " in " + insn);
                    }
                }
            }
            if (!reachable.contains(block)) continue;
            if (!block.isTerminated()) {
                errors.add(where + ": reachable block is not terminated");
                continue;
            }
            for (String target : block.successors()) {
                if (func.getBlock(target) == null) {
                    errors.add(where + ": jump to missing block " + target);
                }
            }
        }
    }
}
