package dev.kestrel.analysis;

import java.util.List;

/** Every error found in a program; analysis does not stop at the first one. */
public final class AnalysisException extends Exception {
    private final List<AnalysisError> errors;

    public AnalysisException(List<AnalysisError> errors) {
        super(summarize(errors));
        this.errors = List.copyOf(errors);
    }

    public List<AnalysisError> errors() {
        return errors;
    }

    public boolean has(AnalysisErrorKind kind) {
        return errors.stream().anyMatch(e -> e.kind() == kind);
    }

    private static String summarize(List<AnalysisError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("AnalysisException needs at least one error");
        }
        if (errors.size() == 1) {
            return errors.get(0).toString();
        }
        return errors.size() + " analysis errors; first: " + errors.get(0);
    }
}
