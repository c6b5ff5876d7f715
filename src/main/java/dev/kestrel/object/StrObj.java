package dev.kestrel.object;

import java.util.Objects;
import java.util.function.Consumer;

public final class StrObj extends HeapObject {
    private final String value;

    public StrObj(String value) {
        super(ObjectTag.STRING, HEADER_BYTES + 2L * Objects.requireNonNull(value, "value").length());
        this.value = value;
    }

    public String value() {
        return value;
    }

    @Override
    public void forEachValue(Consumer<Value> visitor) {}
}
