package dev.kestrel.vm;

public enum RuntimeErrorKind {
    /** An operand of the wrong kind, a missing field, an index out of range, a failed host call. */
    TYPE_ERROR,
    NO_MATCHING_ARM,
    NO_MATCHING_OVERLOAD,
    STACK_OVERFLOW,
    OUT_OF_MEMORY
}
