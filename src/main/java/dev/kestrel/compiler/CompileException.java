package dev.kestrel.compiler;

import dev.kestrel.ast.SourcePos;
import java.util.Objects;

/** A construct the analyzer accepts but that has no lowering, such as {@code break} outside a loop. */
public final class CompileException extends Exception {
    private final SourcePos pos;

    public CompileException(SourcePos pos, String message) {
        super(pos + ": " + message);
        this.pos = Objects.requireNonNull(pos, "pos");
    }

    public SourcePos pos() {
        return pos;
    }
}
