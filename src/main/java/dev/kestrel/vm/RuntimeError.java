package dev.kestrel.vm;

import dev.kestrel.ast.SourcePos;
import java.util.Objects;

/** Why the VM halted, and where: source position, function name and pc of the failing instruction. */
public record RuntimeError(RuntimeErrorKind kind, SourcePos pos, String message, String function, int pc) {
    public RuntimeError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(pos, "pos");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(function, "function");
    }

    @Override
    public String toString() {
        return kind + " at " + pos + " (" + function + " pc " + pc + "): " + message;
    }
}
