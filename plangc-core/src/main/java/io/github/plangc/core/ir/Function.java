package io.github.plangc.core.ir;

import io.github.plangc.core.ast.SourceLocation;
import io.github.plangc.core.ext.ExtHolder;
import io.github.plangc.core.symbols.SymbolKind;
import io.github.plangc.core.util.IRPrinter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A compiled policy or rule: a set of {@link BasicBlock basic blocks}, keyed by name,
 * starting from an entry block.
 */
public final class Function extends ExtHolder {
    /**
     * The conventional name of the execution context parameter.
     */
    public static final String CONTEXT_PARAM = "ctx";

    /**
     * The name of this function, unique within its module.
     * Nested rules are named {@code parent.child}.
     */
    @NotNull
    public final String name;
    @NotNull
    public final SymbolKind kind;
    /**
     * The function a rule is nested in, or null for a top-level policy.
     */
    @Nullable
    public final String parent;
    @NotNull
    public final List<String> params;
    @NotNull
    public final ReturnKind returnKind;
    @NotNull
    public final GovernanceMetadata governance;
    /**
     * The position of this function's declaration in its source, across all functions of the module.
     */
    public final int declarationIndex;
    @NotNull
    public final SourceLocation location;

    private final Map<String, BasicBlock> blocks = new LinkedHashMap<>();
    private String entry;

    public Function(
            @NotNull String name,
            @NotNull SymbolKind kind,
            @Nullable String parent,
            @NotNull GovernanceMetadata governance,
            int declarationIndex,
            @NotNull SourceLocation location
    ) {
        this.name = name;
        this.kind = kind;
        this.parent = parent;
        this.params = Collections.singletonList(CONTEXT_PARAM);
        this.returnKind = ReturnKind.DECISION;
        this.governance = governance;
        this.declarationIndex = declarationIndex;
        this.location = location;
    }

    /**
     * Whether this is a top-level policy, as opposed to a nested rule.
     *
     * @return Whether this function is a policy.
     */
    public boolean isPolicy() {
        return kind == SymbolKind.POLICY;
    }

    /**
     * Create a new, empty block in this function. The first block created is the entry block.
     *
     * @param name The name of the block.
     * @return The new block.
     * @throws IllegalArgumentException If a block with this name already exists.
     */
    public BasicBlock newBlock(@NotNull String name) {
        if (blocks.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate block " + name + " in " + this.name);
        }
        BasicBlock block = new BasicBlock(name);
        blocks.put(name, block);
        if (entry == null) entry = name;
        return block;
    }

    @Nullable
    public BasicBlock getBlock(String name) {
        return blocks.get(name);
    }

    /**
     * Get a block that must exist.
     *
     * @param name The name of the block.
     * @return The block.
     * @throws IllegalStateException If there is no such block.
     */
    @NotNull
    public BasicBlock getBlockOrThrow(String name) {
        BasicBlock block = blocks.get(name);
        if (block == null) {
            throw new IllegalStateException("No block " + name + " in " + this.name);
        }
        return block;
    }

    /**
     * Remove a block. The entry block cannot be removed.
     *
     * @param name The name of the block.
     * @return Whether the block existed.
     */
    public boolean removeBlock(String name) {
        if (name.equals(entry)) {
            throw new IllegalArgumentException("Cannot remove entry block of " + this.name);
        }
        return blocks.remove(name) != null;
    }

    /**
     * Get the blocks of this function, in creation order.
     *
     * @return An unmodifiable view of the blocks.
     */
    public Collection<BasicBlock> getBlocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    /**
     * Get the names of this function's blocks, in creation order.
     *
     * @return A copy of the block names.
     */
    public List<String> getBlockNames() {
        return new ArrayList<>(blocks.keySet());
    }

    /**
     * Count the instructions in all blocks of this function, terminators included.
     *
     * @return The instruction count.
     */
    public int instructionCount() {
        int count = 0;
        for (BasicBlock block : blocks.values()) {
            count += block.getInsns().size();
        }
        return count;
    }

    public String getEntry() {
        return entry;
    }

    @NotNull
    public BasicBlock getEntryBlock() {
        return getBlockOrThrow(entry);
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }
}
