package dev.kestrel.bytecode;

/** Where {@link Instruction.MakeClosure} finds the cell for one captured variable. */
public sealed interface CaptureSource permits CaptureSource.Local, CaptureSource.Upvalue {
    /** A cell held in a local slot of the creating frame. */
    record Local(int slot) implements CaptureSource {}

    /** A cell the creating closure captured itself. */
    record Upvalue(int index) implements CaptureSource {}
}
