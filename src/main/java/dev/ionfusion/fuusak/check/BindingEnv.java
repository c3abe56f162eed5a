package dev.ionfusion.fuusak.check;

import java.util.HashSet;
import java.util.Set;

/**
 * Outermost environment: the bindings a file starts with plus its top-level definitions.
 */
public final class BindingEnv implements Env {
    private final Set<String> topLevel;

    public BindingEnv(Set<String> initial) {
        this.topLevel = new HashSet<>(initial);
    }

    public Scope scope() {
        return new Scope(this);
    }

    @Override
    public boolean contains(String symbol) {
        return topLevel.contains(symbol);
    }

    @Override
    public void bindTopLevel(String symbol) {
        topLevel.add(symbol);
    }
}
