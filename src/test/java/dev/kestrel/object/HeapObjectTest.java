package dev.kestrel.object;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeapObjectTest {
    @Test
    void sizesFollowSlotCounts() {
        assertEquals(HeapObject.HEADER_BYTES + 2L * HeapObject.SLOT_BYTES * 2,
                new RecordObj(List.of("a", "b"), List.of(Value.NIL, Value.NIL)).sizeBytes());
        assertEquals(HeapObject.HEADER_BYTES + 3L * HeapObject.SLOT_BYTES,
                new ArrayObj(List.of(Value.NIL, Value.NIL, Value.NIL)).sizeBytes());
        assertEquals(HeapObject.HEADER_BYTES + HeapObject.SLOT_BYTES, new CellObj(Value.NIL).sizeBytes());
        assertEquals(HeapObject.HEADER_BYTES + 8, new StrObj("abcd").sizeBytes());
    }

    @Test
    void recordFieldsByName() {
        RecordObj r = new RecordObj(List.of("x", "y"), List.of(Value.of(1), Value.of(2)));
        assertEquals(1, r.fieldIndex("y"));
        assertEquals(-1, r.fieldIndex("z"));
        r.set(1, Value.of(9));
        assertEquals(Value.of(9), r.get(1));
        assertThrows(IllegalArgumentException.class, () -> new RecordObj(List.of("x"), List.of()));
    }

    @Test
    void forEachValueVisitsEverySlot() {
        Value.Ref cell = new Value.Ref(3, 0);
        ClosureObj closure = new ClosureObj(2, List.of(cell));
        List<Value> seen = new ArrayList<>();
        closure.forEachValue(seen::add);
        assertEquals(List.of(cell), seen);

        seen.clear();
        new StrObj("s").forEachValue(seen::add);
        assertTrue(seen.isEmpty());
    }

    @Test
    void arrayCopyIsDetached() {
        ArrayObj a = new ArrayObj(List.of(Value.of(1)));
        List<Value> snapshot = a.items();
        a.set(0, Value.of(2));
        assertEquals(Value.of(1), snapshot.get(0));
        assertEquals(Value.of(2), a.get(0));
    }

    @Test
    void valueFactoriesAndKinds() {
        assertSame(Value.TRUE, Value.of(true));
        assertSame(Value.FALSE, Value.of(false));
        assertTrue(Value.of(1).isNumber());
        assertTrue(Value.of(1.5).isNumber());
        assertFalse(Value.NIL.isNumber());
        assertEquals("ref", new Value.Ref(0, 0).kind());
        assertThrows(IllegalArgumentException.class, () -> new Value.Ref(-1, 0));
    }
}
