package dev.kestrel.ast;

import java.util.List;
import java.util.Objects;

public sealed interface Stmt
        permits Stmt.Let,
                Stmt.Assign,
                Stmt.SetField,
                Stmt.SetIndex,
                Stmt.FunctionDecl,
                Stmt.If,
                Stmt.Cond,
                Stmt.While,
                Stmt.For,
                Stmt.Loop,
                Stmt.Break,
                Stmt.Continue,
                Stmt.Return,
                Stmt.Disown,
                Stmt.Scope,
                Stmt.ExprStmt {
    SourcePos pos();

    /** {@code let [mut] name [= init]}; {@code init} may be {@code null}. */
    record Let(String name, boolean mutable, Expr init, SourcePos pos) implements Stmt {
        public Let {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(pos, "pos");
        }
    }

    /** {@code set name = value}. */
    record Assign(String name, Expr value, SourcePos pos) implements Stmt {
        public Assign {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record SetField(Expr target, String field, Expr value, SourcePos pos) implements Stmt {
        public SetField {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record SetIndex(Expr target, Expr index, Expr value, SourcePos pos) implements Stmt {
        public SetIndex {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(index, "index");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record FunctionDecl(Expr.Function function) implements Stmt {
        public FunctionDecl {
            Objects.requireNonNull(function, "function");
            if (function.name() == null) {
                throw new IllegalArgumentException("declared function needs a name");
            }
        }

        public String name() {
            return function.name();
        }

        @Override
        public SourcePos pos() {
            return function.pos();
        }
    }

    /** {@code elseBlock} may be {@code null}. */
    record If(Expr condition, Block thenBlock, Block elseBlock, SourcePos pos) implements Stmt {
        public If {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(thenBlock, "thenBlock");
            Objects.requireNonNull(pos, "pos");
        }
    }

    /**
     * Ordered first-match selection.
     *
     * <p>With a {@code scrutinee}, each arm's pattern is tested against it. Without one
     * ({@code scrutinee == null}) every arm must use a wildcard pattern and a guard.</p>
     */
    record Cond(Expr scrutinee, List<Arm> arms, SourcePos pos) implements Stmt {
        public Cond {
            Objects.requireNonNull(arms, "arms");
            Objects.requireNonNull(pos, "pos");
            arms = List.copyOf(arms);
            if (scrutinee == null) {
                for (Arm arm : arms) {
                    if (!(arm.pattern() instanceof Pat.Wildcard) || arm.guard() == null) {
                        throw new IllegalArgumentException("guard-only cond arms need a wildcard pattern and a guard");
                    }
                }
            }
        }

        /** {@code guard} may be {@code null}. */
        public record Arm(Pat pattern, Expr guard, Block body) {
            public Arm {
                Objects.requireNonNull(pattern, "pattern");
                Objects.requireNonNull(body, "body");
            }
        }
    }

    record While(Expr condition, Block body, SourcePos pos) implements Stmt {
        public While {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(pos, "pos");
        }
    }

    /** {@code for variable in from..to}: integer range with exclusive upper bound. */
    record For(String variable, Expr from, Expr to, Block body, SourcePos pos) implements Stmt {
        public For {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(pos, "pos");
        }
    }

    /** {@code forever}: exits only through {@code break} or {@code return}. */
    record Loop(Block body, SourcePos pos) implements Stmt {
        public Loop {
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record Break(SourcePos pos) implements Stmt {
        public Break {
            Objects.requireNonNull(pos, "pos");
        }
    }

    record Continue(SourcePos pos) implements Stmt {
        public Continue {
            Objects.requireNonNull(pos, "pos");
        }
    }

    /** {@code value} may be {@code null} (returns nil). */
    record Return(Expr value, SourcePos pos) implements Stmt {
        public Return {
            Objects.requireNonNull(pos, "pos");
        }
    }

    /** Gives up ownership of a binding; it must be re-initialized before the next read. */
    record Disown(String name, SourcePos pos) implements Stmt {
        public Disown {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record Scope(Block body, SourcePos pos) implements Stmt {
        public Scope {
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record ExprStmt(Expr expr) implements Stmt {
        public ExprStmt {
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public SourcePos pos() {
            return expr.pos();
        }
    }
}
