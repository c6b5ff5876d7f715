package dev.kestrel.bytecode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.kestrel.ast.SourcePos;
import java.util.List;
import org.junit.jupiter.api.Test;

class DisassemblerTest {
    @Test
    void listsTablesAndCode() {
        BytecodeUnit unit = new BytecodeUnit();
        unit.addHostImport("print");
        unit.addGlobal("answer");
        int str = unit.addConstant(new ConstValue.Str("hi"));
        unit.setEntry(
                unit.addFunction(
                        new Function(
                                "main",
                                0,
                                0,
                                0,
                                List.of(
                                        new Instruction.LoadHost(0),
                                        new Instruction.PushConst(str),
                                        new Instruction.Call(1),
                                        new Instruction.Return()),
                                List.of(new SourcePos(3, 5), SourcePos.NONE, SourcePos.NONE, SourcePos.NONE))));

        String text = Disassembler.disassemble(unit);
        assertTrue(text.contains("[0] print"), text);
        assertTrue(text.contains("[0] answer"), text);
        assertTrue(text.contains("PushConst #0 (\"hi\")"), text);
        assertTrue(text.contains("LoadHost 0 (print)  ; 3:5"), text);
        assertTrue(text.contains("entry: fn#0"), text);
    }

    @Test
    void rendersPatternsAndTraps() {
        BytecodeUnit unit = new BytecodeUnit();
        assertEquals(
                "Trap NO_MATCHING_ARM \"no cond arm matches\"",
                Disassembler.render(unit, new Instruction.Trap(TrapKind.NO_MATCHING_ARM, "no cond arm matches")));
        assertEquals("Jump -> 4", Disassembler.render(unit, new Instruction.Jump(4)));
    }

    @Test
    void literalConstantsAreInterned() {
        BytecodeUnit unit = new BytecodeUnit();
        int a = unit.addConstant(new ConstValue.Int(7));
        int b = unit.addConstant(new ConstValue.Int(7));
        int p1 = unit.addConstant(new ConstValue.MatchPattern(new Pattern.Wildcard()));
        int p2 = unit.addConstant(new ConstValue.MatchPattern(new Pattern.Wildcard()));
        assertEquals(a, b);
        assertEquals(p1 + 1, p2);
    }
}
