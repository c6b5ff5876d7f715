package dev.kestrel.ast;

import java.util.List;
import java.util.Objects;

/** A statement list that opens its own lexical scope. */
public record Block(List<Stmt> statements) {
    public Block {
        Objects.requireNonNull(statements, "statements");
        statements = List.copyOf(statements);
    }

    public static Block of(Stmt... statements) {
        return new Block(List.of(statements));
    }
}
