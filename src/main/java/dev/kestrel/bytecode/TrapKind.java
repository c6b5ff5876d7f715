package dev.kestrel.bytecode;

/** Run-time failures the compiler plants explicitly in the instruction stream. */
public enum TrapKind {
    NO_MATCHING_ARM,
    NO_MATCHING_OVERLOAD
}
