package dev.ionfusion.fuusak.check;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Local bindings on top of a parent environment.
 */
public final class Scope implements Env {
    private final Env parent;
    private final Set<String> bindings = new HashSet<>();

    public Scope(Env parent) {
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    public Scope newScope() {
        return new Scope(this);
    }

    public void bind(String symbol) {
        bindings.add(symbol);
    }

    @Override
    public boolean contains(String symbol) {
        return bindings.contains(symbol) || parent.contains(symbol);
    }

    @Override
    public void bindTopLevel(String symbol) {
        parent.bindTopLevel(symbol);
    }
}
