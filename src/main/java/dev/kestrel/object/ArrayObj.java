package dev.kestrel.object;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/** Fixed-length array; elements may be replaced but not added or removed. */
public final class ArrayObj extends HeapObject {
    private final Value[] items;

    public ArrayObj(List<Value> items) {
        super(ObjectTag.ARRAY, HEADER_BYTES + (long) SLOT_BYTES * Objects.requireNonNull(items, "items").size());
        this.items = items.toArray(new Value[0]);
    }

    public int length() {
        return items.length;
    }

    public Value get(int index) {
        return items[index];
    }

    public void set(int index, Value value) {
        items[index] = Objects.requireNonNull(value, "value");
    }

    public List<Value> items() {
        return List.copyOf(Arrays.asList(items));
    }

    @Override
    public void forEachValue(Consumer<Value> visitor) {
        for (Value v : items) {
            visitor.accept(v);
        }
    }
}
