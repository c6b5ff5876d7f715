package dev.kestrel.bytecode;

import dev.kestrel.ast.SourcePos;
import java.util.List;
import java.util.Objects;

/**
 * A compiled function template.
 *
 * <p>The frame's local window holds {@code localCount} slots; the first {@code arity} of them
 * receive the arguments. {@code positions} runs parallel to {@code code}.</p>
 */
public record Function(
        String name,
        int arity,
        int localCount,
        int captureCount,
        List<Instruction> code,
        List<SourcePos> positions) {
    public Function {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(positions, "positions");
        code = List.copyOf(code);
        positions = List.copyOf(positions);
        if (arity < 0) {
            throw new IllegalArgumentException("arity must be >= 0");
        }
        if (localCount < arity) {
            throw new IllegalArgumentException("localCount must be >= arity");
        }
        if (captureCount < 0) {
            throw new IllegalArgumentException("captureCount must be >= 0");
        }
        if (positions.size() != code.size()) {
            throw new IllegalArgumentException(
                    "positions length " + positions.size() + " does not match code length " + code.size());
        }
    }

    public SourcePos positionAt(int pc) {
        if (pc < 0 || pc >= positions.size()) {
            return SourcePos.NONE;
        }
        return positions.get(pc);
    }
}
