package dev.kestrel.compiler;

import static dev.kestrel.Ast.arm;
import static dev.kestrel.Ast.bin;
import static dev.kestrel.Ast.bind;
import static dev.kestrel.Ast.brk;
import static dev.kestrel.Ast.cond;
import static dev.kestrel.Ast.cont;
import static dev.kestrel.Ast.decl;
import static dev.kestrel.Ast.fn;
import static dev.kestrel.Ast.lambda;
import static dev.kestrel.Ast.let;
import static dev.kestrel.Ast.lit;
import static dev.kestrel.Ast.plit;
import static dev.kestrel.Ast.program;
import static dev.kestrel.Ast.record;
import static dev.kestrel.Ast.ret;
import static dev.kestrel.Ast.str;
import static dev.kestrel.Ast.var;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.kestrel.Pipeline;
import dev.kestrel.ast.BinaryOp;
import dev.kestrel.ast.Program;
import dev.kestrel.bytecode.BytecodeUnit;
import dev.kestrel.bytecode.CaptureSource;
import dev.kestrel.bytecode.Function;
import dev.kestrel.bytecode.FunctionId;
import dev.kestrel.bytecode.Instruction;
import dev.kestrel.bytecode.TrapKind;
import dev.kestrel.bytecode.UnitVerifier;
import java.util.List;
import org.junit.jupiter.api.Test;

class BytecodeCompilerTest {
    private static Function function(BytecodeUnit unit, String name) {
        return unit.functions().stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no function " + name));
    }

    private static long count(Function fn, Class<? extends Instruction> kind) {
        return fn.code().stream().filter(kind::isInstance).count();
    }

    @Test
    void compiledUnitPassesVerification() throws Exception {
        BytecodeUnit unit =
                Pipeline.compile(
                        program(
                                decl(fn("add", List.of("a", "b"), ret(bin(BinaryOp.ADD, var("a"), var("b"))))),
                                let("x", lit(1))));
        UnitVerifier.verify(unit);

        assertEquals(new FunctionId(0), unit.entry());
        Function entry = unit.function(unit.entry()).orElseThrow();
        assertEquals("<main>", entry.name());
        assertInstanceOf(Instruction.Return.class, entry.code().get(entry.code().size() - 1));
        assertEquals(List.of("add", "x"), unit.globalNames());
        assertTrue(unit.entryPoints().containsKey("add"));
        assertEquals(2, function(unit, "add").arity());
    }

    @Test
    void breakOutsideLoopIsRejected() {
        CompileException e = assertThrows(CompileException.class, () -> Pipeline.compile(program(brk())));
        assertTrue(e.getMessage().contains("break"), e.getMessage());
        assertThrows(CompileException.class, () -> Pipeline.compile(program(cont())));
    }

    @Test
    void duplicateRecordFieldIsRejected() {
        Program p = program(let("r", record("a", lit(1), "a", lit(2))));
        assertThrows(CompileException.class, () -> Pipeline.compile(p));
    }

    @Test
    void capturedLocalsLiveInCells() throws Exception {
        BytecodeUnit unit =
                Pipeline.compile(
                        program(decl(fn("outer", List.of(), let("n", lit(1)), ret(lambda(List.of(), ret(var("n"))))))));
        Function outer = function(unit, "outer");
        assertEquals(1, count(outer, Instruction.NewCell.class));
        Instruction.MakeClosure make =
                outer.code().stream()
                        .filter(Instruction.MakeClosure.class::isInstance)
                        .map(Instruction.MakeClosure.class::cast)
                        .findFirst()
                        .orElseThrow();
        assertEquals(1, make.captures().size());
        assertInstanceOf(CaptureSource.Local.class, make.captures().get(0));

        Function inner = function(unit, "<anonymous>");
        assertEquals(1, inner.captureCount());
        assertEquals(1, count(inner, Instruction.LoadUpvalue.class));
    }

    @Test
    void condWithDefaultArmNeedsNoTrap() throws Exception {
        BytecodeUnit withDefault =
                Pipeline.compile(program(cond(lit(1), arm(plit(lit(1)), ret(str("one"))), arm(bind("other"), ret(var("other"))))));
        assertEquals(0, count(withDefault.function(withDefault.entry()).orElseThrow(), Instruction.Trap.class));

        BytecodeUnit partial = Pipeline.compile(program(cond(lit(1), arm(plit(lit(1)), ret(str("one"))))));
        Function entry = partial.function(partial.entry()).orElseThrow();
        Instruction.Trap trap =
                entry.code().stream()
                        .filter(Instruction.Trap.class::isInstance)
                        .map(Instruction.Trap.class::cast)
                        .findFirst()
                        .orElseThrow();
        assertEquals(TrapKind.NO_MATCHING_ARM, trap.kind());
    }

    @Test
    void everyFunctionEndsInOverloadTrap() throws Exception {
        BytecodeUnit unit = Pipeline.compile(program(decl(fn("id", List.of("x"), ret(var("x"))))));
        Function id = function(unit, "id");
        Instruction.Trap last = assertInstanceOf(Instruction.Trap.class, id.code().get(id.code().size() - 1));
        assertEquals(TrapKind.NO_MATCHING_OVERLOAD, last.kind());
        assertEquals(id.code().size(), id.positions().size());
    }
}
