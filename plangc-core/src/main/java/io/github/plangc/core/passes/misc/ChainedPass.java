package io.github.plangc.core.passes.misc;

import io.github.plangc.core.passes.IRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sequence of passes, each run on the result of the one before.
 * <p>
 * Chains of chains are flattened, so {@code a.then(b).then(c)} is a single chain of
 * three stages. When a stage throws, the exception carries a suppressed note naming
 * the index and {@link IRPass#describe() name} of that stage.
 *
 * @param <A> The input type.
 * @param <B> The result type of the first part.
 * @param <C> The result type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private static final Logger LOG = LoggerFactory.getLogger(ChainedPass.class);

    private final List<IRPass<?, ?>> stages;
    private final boolean inPlace;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> next) {
        List<IRPass<?, ?>> stages = new ArrayList<>();
        addStages(stages, first);
        addStages(stages, next);
        this.stages = Collections.unmodifiableList(stages);
        inPlace = first.isInPlace() && next.isInPlace();
    }

    private static void addStages(List<IRPass<?, ?>> stages, IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            stages.addAll(((ChainedPass<?, ?, ?>) pass).stages);
        } else {
            stages.add(pass);
        }
    }

    /**
     * Get the stages of this chain, in order.
     *
     * @return The stages.
     */
    public List<IRPass<?, ?>> getStages() {
        return stages;
    }

    @Override
    public boolean isInPlace() {
        return inPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object value = a;
        for (int i = 0; i < stages.size(); i++) {
            IRPass<Object, Object> stage = (IRPass<Object, Object>) stages.get(i);
            LOG.trace("Running pass {} ({})", i, stage.describe());
            try {
                value = stage.run(value);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("running pass " + i + " (" + stage.describe() + ") in chain"));
                throw e;
            }
        }
        return (C) value;
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (IRPass<?, ?> stage : stages) {
            if (sb.length() != 0) sb.append(" -> ");
            sb.append(stage.describe());
        }
        return sb.toString();
    }
}
