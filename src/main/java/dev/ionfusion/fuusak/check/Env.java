package dev.ionfusion.fuusak.check;

/**
 * Chain of bindings an identifier is resolved against.
 */
public interface Env {
    boolean contains(String symbol);

    /**
     * Binds {@code symbol} in the outermost environment of the chain.
     */
    void bindTopLevel(String symbol);
}
