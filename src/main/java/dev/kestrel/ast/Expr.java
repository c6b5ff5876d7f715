package dev.kestrel.ast;

import java.util.List;
import java.util.Objects;

public sealed interface Expr
        permits Expr.Nil,
                Expr.BoolLit,
                Expr.IntLit,
                Expr.FloatLit,
                Expr.StrLit,
                Expr.Var,
                Expr.Binary,
                Expr.Logical,
                Expr.Unary,
                Expr.Call,
                Expr.Function,
                Expr.RecordLit,
                Expr.Field,
                Expr.ArrayLit,
                Expr.Index,
                Expr.Borrow {
    SourcePos pos();

    static boolean isLiteral(Expr e) {
        return e instanceof Nil
                || e instanceof BoolLit
                || e instanceof IntLit
                || e instanceof FloatLit
                || e instanceof StrLit;
    }

    record Nil(SourcePos pos) implements Expr {
        public Nil {
            Objects.requireNonNull(pos, "pos");
        }
    }

    record BoolLit(boolean value, SourcePos pos) implements Expr {
        public BoolLit {
            Objects.requireNonNull(pos, "pos");
        }
    }

    record IntLit(long value, SourcePos pos) implements Expr {
        public IntLit {
            Objects.requireNonNull(pos, "pos");
        }
    }

    record FloatLit(double value, SourcePos pos) implements Expr {
        public FloatLit {
            Objects.requireNonNull(pos, "pos");
        }
    }

    record StrLit(String value, SourcePos pos) implements Expr {
        public StrLit {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record Var(String name, SourcePos pos) implements Expr {
        public Var {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record Binary(BinaryOp op, Expr left, Expr right, SourcePos pos) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record Logical(LogicalOp op, Expr left, Expr right, SourcePos pos) implements Expr {
        public Logical {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record Unary(UnaryOp op, Expr operand, SourcePos pos) implements Expr {
        public Unary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record Call(Expr callee, List<Expr> args, SourcePos pos) implements Expr {
        public Call {
            Objects.requireNonNull(callee, "callee");
            Objects.requireNonNull(args, "args");
            Objects.requireNonNull(pos, "pos");
            args = List.copyOf(args);
        }
    }

    /**
     * A {@code proc}/{@code func} literal.
     *
     * <p>{@code name} is {@code null} for anonymous functions. Every clause must have
     * {@code modes.size()} parameter patterns; clauses are tried in order at call time.</p>
     */
    record Function(
            FunctionKind kind,
            String name,
            List<ParamMode> modes,
            List<Clause> clauses,
            SourcePos pos)
            implements Expr {
        public Function {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(modes, "modes");
            Objects.requireNonNull(clauses, "clauses");
            Objects.requireNonNull(pos, "pos");
            modes = List.copyOf(modes);
            clauses = List.copyOf(clauses);
            if (clauses.isEmpty()) {
                throw new IllegalArgumentException("function needs at least one clause");
            }
            for (Clause c : clauses) {
                if (c.params().size() != modes.size()) {
                    throw new IllegalArgumentException(
                            "clause has "
                                    + c.params().size()
                                    + " parameter(s) but function declares "
                                    + modes.size());
                }
            }
        }

        public int arity() {
            return modes.size();
        }

        public String displayName() {
            return name == null ? "<anonymous>" : name;
        }
    }

    record Clause(List<Pat> params, Block body) {
        public Clause {
            Objects.requireNonNull(params, "params");
            Objects.requireNonNull(body, "body");
            params = List.copyOf(params);
        }
    }

    record RecordLit(List<FieldInit> fields, SourcePos pos) implements Expr {
        public RecordLit {
            Objects.requireNonNull(fields, "fields");
            Objects.requireNonNull(pos, "pos");
            fields = List.copyOf(fields);
        }

        public record FieldInit(String name, Expr value) {
            public FieldInit {
                Objects.requireNonNull(name, "name");
                Objects.requireNonNull(value, "value");
            }
        }
    }

    record Field(Expr target, String name, SourcePos pos) implements Expr {
        public Field {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(pos, "pos");
        }
    }

    record ArrayLit(List<Expr> items, SourcePos pos) implements Expr {
        public ArrayLit {
            Objects.requireNonNull(items, "items");
            Objects.requireNonNull(pos, "pos");
            items = List.copyOf(items);
        }
    }

    record Index(Expr target, Expr index, SourcePos pos) implements Expr {
        public Index {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(index, "index");
            Objects.requireNonNull(pos, "pos");
        }
    }

    /** {@code &name} or {@code &mut name}; only variables can be borrowed. */
    record Borrow(Var target, boolean exclusive, SourcePos pos) implements Expr {
        public Borrow {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(pos, "pos");
        }
    }
}
