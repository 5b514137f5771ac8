package io.github.plangc.core.passes.opts;

import io.github.plangc.core.ir.Category;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Two policies of the same category whose decisions never contradict,
 * and so could be merged into one.
 */
public final class MergeCandidate {
    /**
     * The policy declared first.
     */
    public final String first;
    /**
     * The policy declared second.
     */
    public final String second;
    public final Category category;

    public MergeCandidate(@NotNull String first, @NotNull String second, @NotNull Category category) {
        this.first = first;
        this.second = second;
        this.category = category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MergeCandidate that = (MergeCandidate) o;
        return first.equals(that.first) && second.equals(that.second) && category == that.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second, category);
    }

    @Override
    public String toString() {
        return first + " + " + second + " (" + category + ")";
    }
}
