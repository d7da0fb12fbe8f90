package io.github.eutro.bil2ir.passes.misc;

import io.github.eutro.bil2ir.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A sequence of passes, each given the result of the one before.
 * <p>
 * Nested chains are flattened on construction, so a failure can be reported
 * with its position in the whole pipeline.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final List<IRPass<?, ?>> passes = new ArrayList<>();
    private final boolean isInPlace;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        addFlattened(firstPass);
        addFlattened(nextPass);
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    private void addFlattened(IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            passes.addAll(((ChainedPass<?, ?, ?>) pass).passes);
        } else {
            passes.add(pass);
        }
    }

    /**
     * @return The passes of this chain, in the order they are run.
     */
    public List<IRPass<?, ?>> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = (IRPass<Object, Object>) passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("running pass " + i + " (" + pass + ") in chain"));
                throw t;
            }
        }
        return (C) acc;
    }

    @Override
    public String toString() {
        return passes.stream().map(Object::toString).collect(Collectors.joining(" -> "));
    }
}
