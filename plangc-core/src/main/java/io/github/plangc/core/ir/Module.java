package io.github.plangc.core.ir;

import io.github.plangc.core.ext.CommonExts;
import io.github.plangc.core.ext.ExtHolder;
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
 * A module: the unit of compilation, holding the imports and {@link Function functions}
 * compiled from one PLang program.
 * <p>
 * The module owns the counters that instruction IDs and block names are drawn from,
 * so that separate modules never share identity, even when built concurrently.
 */
public final class Module extends ExtHolder {
    /**
     * The identity of this module.
     */
    @NotNull
    public final String name;
    /**
     * Import paths, in source order.
     */
    public final List<String> imports = new ArrayList<>();
    private final Map<String, Function> functions = new LinkedHashMap<>();

    private int nextInsnId = 1;
    private int nextBlockId = 0;

    public Module(@NotNull String name) {
        this.name = name;
    }

    /**
     * Allocate a new instruction ID. IDs are never handed out twice.
     *
     * @return The ID.
     */
    public int newInsnId() {
        return nextInsnId++;
    }

    /**
     * Allocate a new block name with the given prefix.
     *
     * @param prefix The prefix, describing the block's role.
     * @return A name unique within this module.
     */
    public String newBlockName(String prefix) {
        return prefix + "." + nextBlockId++;
    }

    /**
     * Add a function to this module.
     *
     * @param function The function.
     * @throws IllegalArgumentException If a function of the same name exists.
     */
    public void addFunction(@NotNull Function function) {
        if (functions.containsKey(function.name)) {
            throw new IllegalArgumentException("Duplicate function " + function.name);
        }
        functions.put(function.name, function);
        function.attachExt(CommonExts.OWNING_MODULE, this);
    }

    @Nullable
    public Function getFunction(String name) {
        return functions.get(name);
    }

    /**
     * Get every function of this module, in the order they were added.
     *
     * @return An unmodifiable view of the functions.
     */
    public Collection<Function> getFunctions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    /**
     * Get the top-level policy functions, in declaration order.
     *
     * @return The policies.
     */
    public List<Function> getPolicies() {
        List<Function> policies = new ArrayList<>();
        for (Function function : functions.values()) {
            if (function.isPolicy()) {
                policies.add(function);
            }
        }
        policies.sort((a, b) -> Integer.compare(a.declarationIndex, b.declarationIndex));
        return policies;
    }

    /**
     * Count the instructions of every function in this module.
     *
     * @return The instruction count.
     */
    public int instructionCount() {
        int count = 0;
        for (Function function : functions.values()) {
            count += function.instructionCount();
        }
        return count;
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }
}
