package dev.kestrel.bytecode;

import java.util.List;
import java.util.Objects;

/**
 * Stack machine instruction set.
 *
 * <p>Operands come from the operand stack unless a component names a slot, constant or jump
 * target. Slots index the current frame's local window; jump targets are absolute pcs within
 * the same function.</p>
 */
public sealed interface Instruction
        permits Instruction.PushConst,
                Instruction.PushNil,
                Instruction.PushBool,
                Instruction.Pop,
                Instruction.Dup,
                Instruction.LoadLocal,
                Instruction.StoreLocal,
                Instruction.NewCell,
                Instruction.LoadCell,
                Instruction.StoreCell,
                Instruction.LoadUpvalue,
                Instruction.StoreUpvalue,
                Instruction.LoadGlobal,
                Instruction.StoreGlobal,
                Instruction.LoadHost,
                Instruction.Add,
                Instruction.Sub,
                Instruction.Mul,
                Instruction.Div,
                Instruction.Mod,
                Instruction.Neg,
                Instruction.BitAnd,
                Instruction.BitOr,
                Instruction.BitXor,
                Instruction.Shl,
                Instruction.Shr,
                Instruction.BitNot,
                Instruction.Not,
                Instruction.Eq,
                Instruction.Ne,
                Instruction.Lt,
                Instruction.Le,
                Instruction.Gt,
                Instruction.Ge,
                Instruction.Jump,
                Instruction.JumpIfFalse,
                Instruction.JumpIfTrue,
                Instruction.Call,
                Instruction.Return,
                Instruction.MakeClosure,
                Instruction.MakeRecord,
                Instruction.GetField,
                Instruction.SetField,
                Instruction.MakeArray,
                Instruction.GetIndex,
                Instruction.SetIndex,
                Instruction.TestPattern,
                Instruction.Trap {
    /** Pushes a literal constant; string constants allocate a fresh heap string. */
    record PushConst(int index) implements Instruction {}

    record PushNil() implements Instruction {}

    record PushBool(boolean value) implements Instruction {}

    record Pop() implements Instruction {}

    record Dup() implements Instruction {}

    record LoadLocal(int slot) implements Instruction {}

    /** Pops into a slot. */
    record StoreLocal(int slot) implements Instruction {}

    /** Replaces the top of stack with a new cell holding it. */
    record NewCell() implements Instruction {}

    /** Pushes the content of the cell held in {@code slot}. */
    record LoadCell(int slot) implements Instruction {}

    /** Pops into the cell held in {@code slot}. */
    record StoreCell(int slot) implements Instruction {}

    record LoadUpvalue(int index) implements Instruction {}

    record StoreUpvalue(int index) implements Instruction {}

    record LoadGlobal(int index) implements Instruction {}

    record StoreGlobal(int index) implements Instruction {}

    record LoadHost(int index) implements Instruction {}

    record Add() implements Instruction {}

    record Sub() implements Instruction {}

    record Mul() implements Instruction {}

    record Div() implements Instruction {}

    record Mod() implements Instruction {}

    record Neg() implements Instruction {}

    record BitAnd() implements Instruction {}

    record BitOr() implements Instruction {}

    record BitXor() implements Instruction {}

    record Shl() implements Instruction {}

    record Shr() implements Instruction {}

    record BitNot() implements Instruction {}

    record Not() implements Instruction {}

    record Eq() implements Instruction {}

    record Ne() implements Instruction {}

    record Lt() implements Instruction {}

    record Le() implements Instruction {}

    record Gt() implements Instruction {}

    record Ge() implements Instruction {}

    record Jump(int targetPc) implements Instruction {}

    /** Pops a bool; jumps when it is false. */
    record JumpIfFalse(int targetPc) implements Instruction {}

    /** Pops a bool; jumps when it is true. */
    record JumpIfTrue(int targetPc) implements Instruction {}

    /** Stack: {@code callee, arg0 .. arg(argc-1)}; replaced by the result on return. */
    record Call(int argc) implements Instruction {}

    /** Pops the result and returns it to the caller. */
    record Return() implements Instruction {}

    record MakeClosure(int templateConst, List<CaptureSource> captures) implements Instruction {
        public MakeClosure {
            Objects.requireNonNull(captures, "captures");
            captures = List.copyOf(captures);
        }
    }

    /** Pops one value per field (pushed in field order) and pushes the new record. */
    record MakeRecord(List<String> fields) implements Instruction {
        public MakeRecord {
            Objects.requireNonNull(fields, "fields");
            fields = List.copyOf(fields);
        }
    }

    record GetField(String field) implements Instruction {
        public GetField {
            Objects.requireNonNull(field, "field");
        }
    }

    /** Stack: {@code record, value}; both popped. */
    record SetField(String field) implements Instruction {
        public SetField {
            Objects.requireNonNull(field, "field");
        }
    }

    record MakeArray(int count) implements Instruction {}

    /** Stack: {@code array, index}. */
    record GetIndex() implements Instruction {}

    /** Stack: {@code array, index, value}; all popped. */
    record SetIndex() implements Instruction {}

    /**
     * Tests the value in {@code slot} against a pattern constant and pushes the outcome. On
     * success the bound values are written to {@code bindSlots}, in pattern order; on failure no
     * slot is written.
     */
    record TestPattern(int slot, int patternConst, List<Integer> bindSlots) implements Instruction {
        public TestPattern {
            Objects.requireNonNull(bindSlots, "bindSlots");
            bindSlots = List.copyOf(bindSlots);
        }
    }

    record Trap(TrapKind kind, String message) implements Instruction {
        public Trap {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }
    }
}
