package dev.kestrel.ast;

/** Short-circuiting boolean connectives ({@code and}, {@code or}). */
public enum LogicalOp {
    AND,
    OR
}
