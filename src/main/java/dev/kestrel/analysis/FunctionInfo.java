package dev.kestrel.analysis;

import java.util.List;
import java.util.Objects;

/**
 * Frame layout of one function: slots {@code [0, arity)} hold the arguments, the rest of
 * {@code [0, localCount)} the declared locals.
 */
public record FunctionInfo(String name, int arity, int localCount, List<Resolved> captures) {
    public FunctionInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(captures, "captures");
        captures = List.copyOf(captures);
    }
}
