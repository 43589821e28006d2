package com.github.dimitryivaniuta.wrappers.operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Explicit decorator chain. Wrappers added later sit further out:
 * {@code OperationChain.of(op).with(retry).with(cache)} gives {@code cache(retry(op))}.
 */
public final class OperationChain {

    private final Operation terminal;
    private final List<OperationWrapper> wrappers = new ArrayList<>();

    private OperationChain(Operation terminal) {
        this.terminal = Objects.requireNonNull(terminal, "terminal must not be null");
    }

    public static OperationChain of(Operation terminal) {
        return new OperationChain(terminal);
    }

    public OperationChain with(OperationWrapper wrapper) {
        wrappers.add(Objects.requireNonNull(wrapper, "wrapper must not be null"));
        return this;
    }

    /**
     * Composes {@code outerToInner} around {@code terminal}; the first element ends up outermost.
     */
    public static Operation compose(List<? extends OperationWrapper> outerToInner, Operation terminal) {
        Operation op = terminal;
        for (int i = outerToInner.size() - 1; i >= 0; i--) {
            op = outerToInner.get(i).wrap(op);
        }
        return op;
    }

    public Operation build() {
        List<OperationWrapper> outerToInner = new ArrayList<>(wrappers);
        Collections.reverse(outerToInner);
        return compose(outerToInner, terminal);
    }
}
