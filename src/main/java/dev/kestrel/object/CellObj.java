package dev.kestrel.object;

import java.util.Objects;
import java.util.function.Consumer;

/** Upvalue cell: a captured variable shared between its declaring frame and closures. */
public final class CellObj extends HeapObject {
    private Value value;

    public CellObj(Value value) {
        super(ObjectTag.CELL, HEADER_BYTES + SLOT_BYTES);
        this.value = Objects.requireNonNull(value, "value");
    }

    public Value get() {
        return value;
    }

    public void set(Value value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public void forEachValue(Consumer<Value> visitor) {
        visitor.accept(value);
    }
}
