package dev.kestrel.ast;

import java.util.List;
import java.util.Objects;

/**
 * Parser output: the host functions the program expects to be installed, and its top-level
 * statements.
 */
public record Program(List<String> hostImports, List<Stmt> statements) {
    public Program {
        Objects.requireNonNull(hostImports, "hostImports");
        Objects.requireNonNull(statements, "statements");
        hostImports = List.copyOf(hostImports);
        statements = List.copyOf(statements);
    }

    public static Program of(Stmt... statements) {
        return new Program(List.of(), List.of(statements));
    }
}
