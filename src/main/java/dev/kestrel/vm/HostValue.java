package dev.kestrel.vm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A value crossing the host boundary. Always a deep copy: the host never holds heap references.
 */
public sealed interface HostValue
        permits HostValue.Nil,
                HostValue.Bool,
                HostValue.Int,
                HostValue.Float,
                HostValue.Str,
                HostValue.Array,
                HostValue.Record,
                HostValue.Function {
    record Nil() implements HostValue {}

    record Bool(boolean value) implements HostValue {}

    record Int(long value) implements HostValue {}

    record Float(double value) implements HostValue {}

    record Str(String value) implements HostValue {
        public Str {
            Objects.requireNonNull(value, "value");
        }
    }

    record Array(List<HostValue> items) implements HostValue {
        public Array {
            Objects.requireNonNull(items, "items");
            items = List.copyOf(items);
        }
    }

    /** Field order is preserved. */
    record Record(Map<String, HostValue> fields) implements HostValue {
        public Record {
            Objects.requireNonNull(fields, "fields");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    /**
     * A function, by name: a global function or host import when passed in; when returned, the
     * name of the function the closure was compiled from.
     */
    record Function(String name) implements HostValue {
        public Function {
            Objects.requireNonNull(name, "name");
        }
    }

    static HostValue nil() {
        return new Nil();
    }

    static HostValue of(long n) {
        return new Int(n);
    }
}
