package dev.kestrel.ast;

/** 1-based line/column of a node in the parsed source; {@link #NONE} when the parser had none. */
public record SourcePos(int line, int column) {
    public static final SourcePos NONE = new SourcePos(0, 0);

    public SourcePos {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line/column must be >= 0");
        }
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "?";
    }
}
