package dev.kestrel.analysis;

import dev.kestrel.ast.SourcePos;
import java.util.Objects;

public record AnalysisError(AnalysisErrorKind kind, SourcePos pos, String name, String message) {
    public AnalysisError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(pos, "pos");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return pos + ": " + kind + ": " + message;
    }
}
