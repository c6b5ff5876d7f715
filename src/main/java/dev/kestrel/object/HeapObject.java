package dev.kestrel.object;

import java.util.function.Consumer;

/**
 * Base of everything that lives in the collected heap.
 *
 * <p>The byte size is fixed at construction: strings are immutable and records, arrays and
 * closures never change their number of slots. Only the collector touches the mark bit.</p>
 */
public abstract sealed class HeapObject permits StrObj, RecordObj, ClosureObj, ArrayObj, CellObj {
    public static final int HEADER_BYTES = 16;
    public static final int SLOT_BYTES = 8;

    private final ObjectTag tag;
    private final long sizeBytes;
    private boolean marked;

    HeapObject(ObjectTag tag, long sizeBytes) {
        this.tag = tag;
        this.sizeBytes = sizeBytes;
    }

    public final ObjectTag tag() {
        return tag;
    }

    public final long sizeBytes() {
        return sizeBytes;
    }

    public final boolean isMarked() {
        return marked;
    }

    public final void setMarked(boolean marked) {
        this.marked = marked;
    }

    /** Feeds every value this object holds to {@code visitor}; the collector follows the references. */
    public abstract void forEachValue(Consumer<Value> visitor);
}
