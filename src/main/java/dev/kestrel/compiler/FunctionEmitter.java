package dev.kestrel.compiler;

import dev.kestrel.ast.SourcePos;
import dev.kestrel.bytecode.Function;
import dev.kestrel.bytecode.Instruction;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/** Instruction buffer for one function under compilation. */
final class FunctionEmitter {
    private final String name;
    private final int arity;
    private final int captureCount;
    private final List<Instruction> code = new ArrayList<>();
    private final List<SourcePos> positions = new ArrayList<>();
    private int nextTemp;

    final ArrayDeque<LoopContext> loops = new ArrayDeque<>();
    SourcePos pos = SourcePos.NONE;

    FunctionEmitter(String name, int arity, int localCount, int captureCount) {
        this.name = name;
        this.arity = arity;
        this.captureCount = captureCount;
        this.nextTemp = localCount;
    }

    String name() {
        return name;
    }

    /** Emits at the current source position; returns the instruction's pc. */
    int emit(Instruction inst) {
        code.add(inst);
        positions.add(pos);
        return code.size() - 1;
    }

    /** Emits a jump whose target is filled in later by {@link #patchJump}. */
    int emitJump(JumpKind kind) {
        return emit(kind.make(-1));
    }

    void patchJump(int pc, int target) {
        Instruction old = code.get(pc);
        if (old instanceof Instruction.Jump) {
            code.set(pc, new Instruction.Jump(target));
        } else if (old instanceof Instruction.JumpIfFalse) {
            code.set(pc, new Instruction.JumpIfFalse(target));
        } else if (old instanceof Instruction.JumpIfTrue) {
            code.set(pc, new Instruction.JumpIfTrue(target));
        } else {
            throw new IllegalStateException("pc " + pc + " in `" + name + "` is not a jump: " + old);
        }
    }

    void patchJumpsHere(List<Integer> pcs) {
        for (int pc : pcs) {
            patchJump(pc, here());
        }
    }

    int here() {
        return code.size();
    }

    /** A scratch slot past the declared locals. */
    int allocTemp() {
        return nextTemp++;
    }

    Function finish() {
        return new Function(name, arity, nextTemp, captureCount, code, positions);
    }

    enum JumpKind {
        ALWAYS,
        IF_FALSE,
        IF_TRUE;

        Instruction make(int target) {
            switch (this) {
                case IF_FALSE:
                    return new Instruction.JumpIfFalse(target);
                case IF_TRUE:
                    return new Instruction.JumpIfTrue(target);
                default:
                    return new Instruction.Jump(target);
            }
        }
    }
}
