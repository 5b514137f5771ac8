package io.github.plangc.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;
import java.util.function.IntUnaryOperator;

/**
 * {@code %id = call target(%args...)}, either a runtime builtin or another function of the module.
 */
public final class Call extends Insn {
    @NotNull
    public final String target;
    private final List<Integer> args;

    public Call(int id, @NotNull String target, @NotNull List<Integer> args) {
        super(id);
        this.target = target;
        this.args = new ArrayList<>(args);
    }

    @Override
    public List<Integer> operands() {
        return Collections.unmodifiableList(args);
    }

    @Override
    public void remapOperands(IntUnaryOperator remap) {
        ListIterator<Integer> li = args.listIterator();
        while (li.hasNext()) {
            li.set(remap.applyAsInt(li.next()));
        }
    }

    @Override
    public <R> R accept(InsnVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
