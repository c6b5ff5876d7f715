package dev.kestrel.analysis;

import dev.kestrel.ast.Expr;
import dev.kestrel.ast.ParamMode;
import dev.kestrel.ast.SourcePos;
import java.util.Objects;

/**
 * A declared name. Identity matters: two declarations of the same name are two symbols.
 *
 * <p>{@link #function()} is set when the binding can only ever hold one known function (a
 * function declaration, or an immutable {@code let} of a function literal); call sites use it
 * to find the parameter modes.</p>
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final int index;
    private final boolean mutable;
    private final ParamMode mode;
    private final SourcePos pos;
    private final Expr.Function function;
    private boolean captured;

    Symbol(
            String name,
            SymbolKind kind,
            int index,
            boolean mutable,
            ParamMode mode,
            SourcePos pos,
            Expr.Function function) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.index = index;
        this.mutable = mutable;
        this.mode = Objects.requireNonNull(mode, "mode");
        this.pos = Objects.requireNonNull(pos, "pos");
        this.function = function;
    }

    public String name() {
        return name;
    }

    public SymbolKind kind() {
        return kind;
    }

    public int index() {
        return index;
    }

    public ParamMode mode() {
        return mode;
    }

    public SourcePos pos() {
        return pos;
    }

    public Expr.Function function() {
        return function;
    }

    /** True if a nested function refers to this local; its slot then holds a cell. */
    public boolean isCaptured() {
        return captured;
    }

    void markCaptured() {
        if (kind != SymbolKind.LOCAL) {
            throw new IllegalStateException("only locals can be captured: " + this);
        }
        captured = true;
    }

    /** Whether the binding may be rebound or borrowed exclusively. */
    boolean isWritable() {
        return mutable || mode == ParamMode.EXCLUSIVE;
    }

    @Override
    public String toString() {
        return name + "@" + kind.name().toLowerCase() + index;
    }
}
