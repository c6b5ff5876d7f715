package dev.kestrel.ast;

/**
 * {@code proc} has side effects, {@code func} is a function of its inputs.
 *
 * <p>Both are analyzed, compiled and executed identically.</p>
 */
public enum FunctionKind {
    PROC,
    FUNC
}
