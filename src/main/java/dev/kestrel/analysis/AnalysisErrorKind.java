package dev.kestrel.analysis;

public enum AnalysisErrorKind {
    /** A name declared twice in the same scope. */
    DUPLICATE_BINDING,
    /** A read of a binding that is not initialized on every path reaching it. */
    USE_OF_UNINITIALIZED,
    /** Overlapping accesses where at least one is exclusive or a move. */
    CONFLICTING_BORROW,
    /** A read of a binding whose value was moved away. */
    USE_AFTER_MOVE,
    UNDEFINED_NAME,
    /** A write to an immutable binding or through a shared borrow. */
    IMMUTABLE_ASSIGNMENT
}
