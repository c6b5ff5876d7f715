package dev.kestrel.gc;

import dev.kestrel.object.Value;
import java.util.function.Consumer;

/**
 * Supplies the values the collector must treat as live.
 *
 * <p>Only called at a safepoint, when the owner guarantees the set is complete.</p>
 */
@FunctionalInterface
public interface RootSet {
    void visitRoots(Consumer<Value> visitor);
}
