package dev.ionfusion.fuusak.index;

/**
 * Position of a module in its {@link FusionIndex}. Handles stay valid when a module is reloaded.
 */
public record ModuleHandle(int index) {
    public ModuleHandle {
        if (index < 0) {
            throw new IllegalArgumentException("Invalid module handle " + index);
        }
    }
}
