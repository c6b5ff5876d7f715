package dev.kestrel.vm;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/** Host function implementations, looked up by import name when a {@link Vm} is created. */
public final class HostImportRegistry {
    private final Map<String, HostFn> byName = new HashMap<>();

    public HostImportRegistry register(String name, HostFn fn) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fn, "fn");
        byName.put(name, fn);
        return this;
    }

    HostFn resolve(String name) {
        return byName.get(name);
    }
}
