package dev.kestrel.ast;

public enum UnaryOp {
    NEG,
    NOT,
    BIT_NOT
}
