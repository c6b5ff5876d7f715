package dev.kestrel.gc;

import dev.kestrel.object.HeapObject;
import dev.kestrel.object.Value;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-moving mark-sweep heap.
 *
 * <p>Objects live in an arena of slots. A slot freed by the sweep goes on a free list and is
 * handed out again by a later allocation; its generation is bumped so that references to the
 * previous occupant are recognised as dangling.</p>
 *
 * <p>Allocation never collects. It only records that a collection is due; the owner (the VM)
 * calls {@link #collect(RootSet)} at its next safepoint.</p>
 */
public final class Heap {
    private static final Logger LOG = LoggerFactory.getLogger(Heap.class);

    private final HeapConfig config;

    private final ArrayList<HeapObject> slots = new ArrayList<>();
    private int[] generations = new int[64];
    private final ArrayDeque<Integer> freeSlots = new ArrayDeque<>();

    private long bytesInUse;
    private int objectCount;
    private long allocatedSinceCollection;
    private long threshold;

    private int cycles;
    private long objectsAllocated;
    private long bytesAllocated;
    private long objectsFreed;
    private long bytesFreed;
    private long peakBytesInUse;

    public Heap(HeapConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.threshold = config.initialThresholdBytes();
    }

    public Value.Ref allocate(HeapObject obj) throws HeapExhaustedException {
        Objects.requireNonNull(obj, "obj");
        long size = obj.sizeBytes();
        if (bytesInUse + size > config.maxHeapBytes()) {
            throw new HeapExhaustedException(size, bytesInUse, config.maxHeapBytes());
        }

        int index;
        Integer reused = freeSlots.pollFirst();
        if (reused != null) {
            index = reused;
            slots.set(index, obj);
        } else {
            index = slots.size();
            slots.add(obj);
            if (index >= generations.length) {
                generations = Arrays.copyOf(generations, generations.length * 2);
            }
        }
        obj.setMarked(false);

        bytesInUse += size;
        objectCount += 1;
        allocatedSinceCollection += size;
        objectsAllocated += 1;
        bytesAllocated += size;
        peakBytesInUse = Math.max(peakBytesInUse, bytesInUse);
        return new Value.Ref(index, generations[index]);
    }

    /** True once the bytes allocated since the last cycle reached the current threshold. */
    public boolean collectionDue() {
        return allocatedSinceCollection >= threshold;
    }

    public HeapObject get(Value.Ref ref) {
        HeapObject obj = lookup(ref);
        if (obj == null) {
            throw new IllegalStateException("dangling heap reference " + ref);
        }
        return obj;
    }

    /** False if the object {@code ref} pointed to has been reclaimed. */
    public boolean isLive(Value.Ref ref) {
        return lookup(ref) != null;
    }

    private HeapObject lookup(Value.Ref ref) {
        Objects.requireNonNull(ref, "ref");
        int index = ref.index();
        if (index >= slots.size() || generations[index] != ref.generation()) {
            return null;
        }
        return slots.get(index);
    }

    public GcCycle collect(RootSet roots) {
        Objects.requireNonNull(roots, "roots");
        long start = System.nanoTime();
        cycles += 1;

        int marked = mark(roots);

        // sweep
        int freedCount = 0;
        long freedBytes = 0;
        for (int i = 0; i < slots.size(); i++) {
            HeapObject obj = slots.get(i);
            if (obj == null) {
                continue;
            }
            if (obj.isMarked()) {
                obj.setMarked(false);
                continue;
            }
            if (LOG.isTraceEnabled()) {
                LOG.trace("gc #{}: freed {} #{} ({} bytes)", cycles, obj.tag().displayName(), i, obj.sizeBytes());
            }
            slots.set(i, null);
            generations[i] += 1;
            freeSlots.addFirst(i);
            freedCount += 1;
            freedBytes += obj.sizeBytes();
        }

        bytesInUse -= freedBytes;
        objectCount -= freedCount;
        objectsFreed += freedCount;
        bytesFreed += freedBytes;
        allocatedSinceCollection = 0;
        threshold = Math.max(config.initialThresholdBytes(), (long) (bytesInUse * config.growthFactor()));

        GcCycle cycle =
                new GcCycle(cycles, marked, freedCount, freedBytes, bytesInUse, threshold, System.nanoTime() - start);
        LOG.debug(
                "gc #{}: marked {}, freed {} object(s) / {} bytes, live {} bytes, next threshold {} bytes, {} us",
                cycle.cycle(),
                cycle.objectsMarked(),
                cycle.objectsFreed(),
                cycle.bytesFreed(),
                cycle.liveBytes(),
                cycle.nextThreshold(),
                cycle.elapsedNanos() / 1000);
        return cycle;
    }

    // Work-list traversal: Java stack depth is constant whatever the object graph depth.
    private int mark(RootSet roots) {
        ArrayDeque<HeapObject> work = new ArrayDeque<>();
        int[] marked = {0};
        Consumer<Value> markValue =
                v -> {
                    if (!(v instanceof Value.Ref ref)) {
                        return;
                    }
                    HeapObject obj = get(ref);
                    if (!obj.isMarked()) {
                        obj.setMarked(true);
                        marked[0] += 1;
                        work.push(obj);
                    }
                };
        roots.visitRoots(markValue);
        while (!work.isEmpty()) {
            work.pop().forEachValue(markValue);
        }
        return marked[0];
    }

    public long bytesInUse() {
        return bytesInUse;
    }

    public int objectCount() {
        return objectCount;
    }

    public long threshold() {
        return threshold;
    }

    public GcStats stats() {
        return new GcStats(cycles, objectsAllocated, bytesAllocated, objectsFreed, bytesFreed, peakBytesInUse);
    }
}
