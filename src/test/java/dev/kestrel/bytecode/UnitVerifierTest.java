package dev.kestrel.bytecode;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.kestrel.ast.SourcePos;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class UnitVerifierTest {
    private static Function fn(String name, int arity, int locals, int captures, Instruction... code) {
        return new Function(
                name, arity, locals, captures, List.of(code), Collections.nCopies(code.length, SourcePos.NONE));
    }

    private static BytecodeUnit unitWithEntry(Instruction... code) {
        BytecodeUnit unit = new BytecodeUnit();
        unit.setEntry(unit.addFunction(fn("main", 0, 1, 0, code)));
        return unit;
    }

    private static void assertRejected(BytecodeUnit unit, String fragment) {
        VerifyException e = assertThrows(VerifyException.class, () -> UnitVerifier.verify(unit));
        assertTrue(e.getMessage().contains(fragment), e.getMessage());
    }

    @Test
    void acceptsMinimalUnit() {
        assertDoesNotThrow(() -> UnitVerifier.verify(unitWithEntry(new Instruction.PushNil(), new Instruction.Return())));
    }

    @Test
    void rejectsEmptyUnit() {
        assertRejected(new BytecodeUnit(), "no functions");
    }

    @Test
    void rejectsUnknownVersion() {
        BytecodeUnit unit = new BytecodeUnit(99);
        unit.addFunction(fn("main", 0, 0, 0, new Instruction.PushNil(), new Instruction.Return()));
        assertRejected(unit, "version");
    }

    @Test
    void rejectsReservedButUndefinedFunction() {
        BytecodeUnit unit = unitWithEntry(new Instruction.PushNil(), new Instruction.Return());
        unit.reserveFunction("later");
        assertRejected(unit, "never defined");
    }

    @Test
    void rejectsEntryWithParameters() {
        BytecodeUnit unit = new BytecodeUnit();
        unit.setEntry(unit.addFunction(fn("main", 1, 1, 0, new Instruction.PushNil(), new Instruction.Return())));
        assertRejected(unit, "no arguments");
    }

    @Test
    void rejectsCodeThatFallsOffTheEnd() {
        assertRejected(unitWithEntry(new Instruction.PushNil()), "run past");
    }

    @Test
    void rejectsOutOfRangeOperands() {
        assertRejected(
                unitWithEntry(new Instruction.LoadLocal(5), new Instruction.Return()), "slot 5 out of range");
        assertRejected(unitWithEntry(new Instruction.Jump(7)), "pc 7 out of range");
        assertRejected(
                unitWithEntry(new Instruction.LoadGlobal(0), new Instruction.Return()), "out of range");
        assertRejected(
                unitWithEntry(new Instruction.PushConst(3), new Instruction.Return()), "out of range");
    }

    @Test
    void rejectsPushOfNonLiteralConstant() {
        BytecodeUnit unit = new BytecodeUnit();
        int pattern = unit.addConstant(new ConstValue.MatchPattern(new Pattern.Wildcard()));
        unit.setEntry(unit.addFunction(fn("main", 0, 0, 0, new Instruction.PushConst(pattern), new Instruction.Return())));
        assertRejected(unit, "non-literal");
    }

    @Test
    void rejectsClosureWithWrongCaptureCount() {
        BytecodeUnit unit = new BytecodeUnit();
        FunctionId main = unit.reserveFunction("main");
        FunctionId inner =
                unit.addFunction(fn("inner", 0, 0, 1, new Instruction.LoadUpvalue(0), new Instruction.Return()));
        int template = unit.addConstant(new ConstValue.Function(inner));
        unit.defineFunction(
                main, fn("main", 0, 0, 0, new Instruction.MakeClosure(template, List.of()), new Instruction.Return()));
        unit.setEntry(main);
        assertRejected(unit, "template expects 1");
    }

    @Test
    void rejectsPatternWithMismatchedBindSlots() {
        BytecodeUnit unit = new BytecodeUnit();
        int pattern =
                unit.addConstant(
                        new ConstValue.MatchPattern(new Pattern.Array(List.of(new Pattern.Bind(), new Pattern.Bind()))));
        unit.setEntry(
                unit.addFunction(
                        fn(
                                "main",
                                0,
                                2,
                                0,
                                new Instruction.TestPattern(0, pattern, List.of(1)),
                                new Instruction.Return())));
        assertRejected(unit, "pattern binds 2");
    }

    @Test
    void rejectsEntryPointWithoutGlobal() {
        BytecodeUnit unit = unitWithEntry(new Instruction.PushNil(), new Instruction.Return());
        unit.addEntryPoint("helper", unit.entry());
        assertRejected(unit, "no global slot");
    }
}
