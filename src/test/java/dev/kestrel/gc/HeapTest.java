package dev.kestrel.gc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.kestrel.object.ArrayObj;
import dev.kestrel.object.CellObj;
import dev.kestrel.object.ClosureObj;
import dev.kestrel.object.HeapObject;
import dev.kestrel.object.RecordObj;
import dev.kestrel.object.StrObj;
import dev.kestrel.object.Value;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeapTest {
    private static RootSet roots(Value... values) {
        List<Value> list = List.of(values);
        return visitor -> list.forEach(visitor);
    }

    /** Sum of the sizes of everything reachable from {@code roots}, computed independently of the collector. */
    private static long reachableBytes(Heap heap, Value... roots) {
        IdentityHashMap<HeapObject, Boolean> seen = new IdentityHashMap<>();
        ArrayDeque<Value> work = new ArrayDeque<>(List.of(roots));
        long total = 0;
        while (!work.isEmpty()) {
            if (!(work.pop() instanceof Value.Ref ref)) {
                continue;
            }
            HeapObject obj = heap.get(ref);
            if (seen.put(obj, Boolean.TRUE) == null) {
                total += obj.sizeBytes();
                obj.forEachValue(work::push);
            }
        }
        return total;
    }

    @Test
    void allocationTracksBytesAndCount() throws Exception {
        Heap heap = new Heap(HeapConfig.defaults());
        StrObj s = new StrObj("abc");
        Value.Ref ref = heap.allocate(s);
        assertSame(s, heap.get(ref));
        assertEquals(s.sizeBytes(), heap.bytesInUse());
        assertEquals(1, heap.objectCount());
        assertEquals(1, heap.stats().objectsAllocated());
    }

    @Test
    void reachableObjectsSurviveCollection() throws Exception {
        Heap heap = new Heap(HeapConfig.defaults());
        Value.Ref leaf = heap.allocate(new StrObj("leaf"));
        Value.Ref array = heap.allocate(new ArrayObj(List.of(leaf, Value.of(1))));
        Value.Ref record = heap.allocate(new RecordObj(List.of("items"), List.of(array)));
        Value.Ref garbage = heap.allocate(new StrObj("garbage"));

        GcCycle cycle = heap.collect(roots(record));

        assertTrue(heap.isLive(leaf));
        assertTrue(heap.isLive(array));
        assertTrue(heap.isLive(record));
        assertFalse(heap.isLive(garbage));
        assertEquals(3, cycle.objectsMarked());
        assertEquals(1, cycle.objectsFreed());
        assertEquals(reachableBytes(heap, record), heap.bytesInUse());
        assertEquals(heap.bytesInUse(), cycle.liveBytes());
    }

    @Test
    void cyclesWithoutRootsAreReclaimed() throws Exception {
        Heap heap = new Heap(HeapConfig.defaults());
        Value.Ref a = heap.allocate(new RecordObj(List.of("next"), List.of(Value.NIL)));
        Value.Ref b = heap.allocate(new RecordObj(List.of("next"), List.of(a)));
        ((RecordObj) heap.get(a)).set(0, b);

        heap.collect(roots());

        assertFalse(heap.isLive(a));
        assertFalse(heap.isLive(b));
        assertEquals(0, heap.bytesInUse());
        assertEquals(0, heap.objectCount());
    }

    @Test
    void rootedCycleSurvivesRepeatedCollections() throws Exception {
        Heap heap = new Heap(HeapConfig.defaults());
        Value.Ref cell = heap.allocate(new CellObj(Value.NIL));
        Value.Ref closure = heap.allocate(new ClosureObj(0, List.of(cell)));
        ((CellObj) heap.get(cell)).set(closure);

        for (int i = 0; i < 3; i++) {
            heap.collect(roots(closure));
        }
        assertTrue(heap.isLive(cell));
        assertTrue(heap.isLive(closure));
        assertEquals(reachableBytes(heap, closure), heap.bytesInUse());
    }

    @Test
    void reusedSlotDoesNotResurrectStaleReference() throws Exception {
        Heap heap = new Heap(HeapConfig.defaults());
        Value.Ref old = heap.allocate(new StrObj("old"));
        heap.collect(roots());

        Value.Ref fresh = heap.allocate(new StrObj("new"));
        assertEquals(old.index(), fresh.index());
        assertNotEquals(old.generation(), fresh.generation());
        assertFalse(heap.isLive(old));
        assertThrows(IllegalStateException.class, () -> heap.get(old));
        assertEquals("new", ((StrObj) heap.get(fresh)).value());
    }

    @Test
    void allocationBeyondMaxHeapFails() throws Exception {
        Heap heap = new Heap(HeapConfig.defaults().withMaxHeap(100));
        heap.allocate(new ArrayObj(List.of(Value.NIL, Value.NIL)));
        HeapExhaustedException e =
                assertThrows(HeapExhaustedException.class, () -> heap.allocate(new StrObj("x".repeat(50))));
        assertEquals(116, e.requestedBytes());
    }

    @Test
    void collectionBecomesDueAfterThresholdAndThresholdAdapts() throws Exception {
        Heap heap = new Heap(HeapConfig.defaults().withInitialThreshold(256));
        List<Value> live = new ArrayList<>();
        while (!heap.collectionDue()) {
            live.add(heap.allocate(new CellObj(Value.of(live.size()))));
        }
        GcCycle cycle = heap.collect(visitor -> live.forEach(visitor));
        assertFalse(heap.collectionDue());
        assertEquals(live.size(), cycle.objectsMarked());
        assertEquals((long) (heap.bytesInUse() * HeapConfig.DEFAULT_GROWTH_FACTOR), heap.threshold());
        assertEquals(1, heap.stats().cycles());
    }
}
