package dev.kestrel.object;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A function template (by index into the bytecode unit's function table) plus the cells it
 * captured when it was created.
 */
public final class ClosureObj extends HeapObject {
    private final int functionIndex;
    private final List<Value.Ref> cells;

    public ClosureObj(int functionIndex, List<Value.Ref> cells) {
        super(ObjectTag.CLOSURE, HEADER_BYTES + SLOT_BYTES + (long) SLOT_BYTES * Objects.requireNonNull(cells, "cells").size());
        if (functionIndex < 0) {
            throw new IllegalArgumentException("functionIndex must be >= 0");
        }
        this.functionIndex = functionIndex;
        this.cells = List.copyOf(cells);
    }

    public int functionIndex() {
        return functionIndex;
    }

    public Value.Ref cell(int index) {
        return cells.get(index);
    }

    @Override
    public void forEachValue(Consumer<Value> visitor) {
        for (Value.Ref c : cells) {
            visitor.accept(c);
        }
    }
}
