package dev.kestrel.vm;

import dev.kestrel.bytecode.Function;
import dev.kestrel.object.Value;
import java.util.Objects;

/** One activation; its locals are the stack window {@code [base, base + fn.localCount())}. */
final class Frame {
    final Function fn;
    final int base;
    // null for the entry function
    final Value.Ref closure;
    int pc;

    Frame(Function fn, int base, Value.Ref closure) {
        this.fn = Objects.requireNonNull(fn, "fn");
        this.base = base;
        this.closure = closure;
    }
}
