package dev.kestrel.vm;

import dev.kestrel.gc.Heap;
import dev.kestrel.gc.HeapConfig;
import dev.kestrel.object.Value;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/** State one VM owns besides its stacks: the heap, the global table and the host functions. */
final class RuntimeContext {
    private final Heap heap;
    // null = never assigned
    private final Value[] globals;
    private final List<String> globalNames;
    private final HostFn[] hostFns;
    private final List<String> hostNames;

    RuntimeContext(HeapConfig heapConfig, List<String> globalNames, List<String> hostNames, HostFn[] hostFns) {
        this.heap = new Heap(Objects.requireNonNull(heapConfig, "heapConfig"));
        this.globalNames = List.copyOf(globalNames);
        this.globals = new Value[globalNames.size()];
        this.hostNames = List.copyOf(hostNames);
        this.hostFns = hostFns.clone();
    }

    Heap heap() {
        return heap;
    }

    Value global(int index) {
        return globals[index];
    }

    void setGlobal(int index, Value value) {
        globals[index] = Objects.requireNonNull(value, "value");
    }

    String globalName(int index) {
        return globalNames.get(index);
    }

    HostFn hostFn(int index) {
        return hostFns[index];
    }

    String hostName(int index) {
        return hostNames.get(index);
    }

    void visitGlobals(Consumer<Value> visitor) {
        for (Value v : globals) {
            if (v != null) {
                visitor.accept(v);
            }
        }
    }
}
