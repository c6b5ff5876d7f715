package dev.kestrel.ast;

/** How a parameter receives its argument; decides the access the call site performs. */
public enum ParamMode {
    /** The argument binding is moved into the callee. */
    OWNED,
    /** Read-only borrow for the duration of the call. */
    SHARED,
    /** Read-write borrow for the duration of the call. */
    EXCLUSIVE
}
