package dev.kestrel.object;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Record with an ordered, fixed set of field names.
 *
 * <p>Field values may be replaced; the set of fields is decided at construction.</p>
 */
public final class RecordObj extends HeapObject {
    private final List<String> names;
    private final Value[] values;

    public RecordObj(List<String> names, List<Value> values) {
        super(ObjectTag.RECORD, HEADER_BYTES + 2L * SLOT_BYTES * Objects.requireNonNull(names, "names").size());
        Objects.requireNonNull(values, "values");
        if (names.size() != values.size()) {
            throw new IllegalArgumentException(
                    "record has " + names.size() + " field name(s) but " + values.size() + " value(s)");
        }
        this.names = List.copyOf(names);
        this.values = values.toArray(new Value[0]);
    }

    public List<String> fieldNames() {
        return names;
    }

    /** Returns -1 if the record has no such field. */
    public int fieldIndex(String name) {
        return names.indexOf(name);
    }

    public Value get(int index) {
        return values[index];
    }

    public void set(int index, Value value) {
        values[index] = Objects.requireNonNull(value, "value");
    }

    @Override
    public void forEachValue(Consumer<Value> visitor) {
        for (Value v : values) {
            visitor.accept(v);
        }
    }
}
