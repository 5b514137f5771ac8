package io.github.plangc.core.util;

import io.github.plangc.core.ir.BasicBlock;
import io.github.plangc.core.ir.Function;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Control flow queries over the blocks of a {@link Function}.
 */
public final class BlockGraph {
    private BlockGraph() {
    }

    /**
     * Get the blocks a block may jump to. Targets naming no block of the function are skipped.
     *
     * @param func  The function.
     * @param block A block of the function.
     * @return The successors, in the order the terminator names them.
     */
    public static List<BasicBlock> successors(Function func, BasicBlock block) {
        List<BasicBlock> succs = new ArrayList<>();
        for (String target : block.successors()) {
            BasicBlock succ = func.getBlock(target);
            if (succ != null && !succs.contains(succ)) succs.add(succ);
        }
        return succs;
    }

    /**
     * Get the blocks reachable from the entry block, following jumps and both arms of conditional jumps.
     * <p>
     * The set iterates depth-first in pre-order, the entry block first, and the true arm of a
     * conditional jump before its false arm.
     *
     * @param func The function.
     * @return The reachable blocks.
     */
    public static Set<BasicBlock> reachable(Function func) {
        Set<BasicBlock> seen = new LinkedHashSet<>();
        Deque<BasicBlock> stack = new ArrayDeque<>();
        stack.push(func.getEntryBlock());
        while (!stack.isEmpty()) {
            BasicBlock block = stack.pop();
            if (!seen.add(block)) continue;
            List<BasicBlock> succs = successors(func, block);
            for (int i = succs.size() - 1; i >= 0; i--) {
                if (!seen.contains(succs.get(i))) stack.push(succs.get(i));
            }
        }
        return seen;
    }
}
