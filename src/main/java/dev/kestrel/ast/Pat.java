package dev.kestrel.ast;

import java.util.List;
import java.util.Objects;

/** Source-level patterns, used by {@code cond} arms and by function parameters. */
public sealed interface Pat permits Pat.Wildcard, Pat.Binding, Pat.Literal, Pat.Destructure, Pat.ArrayPat {
    SourcePos pos();

    record Wildcard(SourcePos pos) implements Pat {
        public Wildcard {
            Objects.requireNonNull(pos, "pos");
        }
    }

    /** Matches anything and binds it to a fresh immutable local. */
    record Binding(String name, SourcePos pos) implements Pat {
        public Binding {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(pos, "pos");
        }
    }

    /**
     * {@code value} must be one of {@link Expr.Nil}, {@link Expr.BoolLit}, {@link Expr.IntLit},
     * {@link Expr.FloatLit} or {@link Expr.StrLit}.
     */
    record Literal(Expr value, SourcePos pos) implements Pat {
        public Literal {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(pos, "pos");
            if (!Expr.isLiteral(value)) {
                throw new IllegalArgumentException("literal pattern needs a literal expression, got " + value);
            }
        }
    }

    /** Matches a record that has at least the listed fields. */
    record Destructure(List<Field> fields, SourcePos pos) implements Pat {
        public Destructure {
            Objects.requireNonNull(fields, "fields");
            Objects.requireNonNull(pos, "pos");
            fields = List.copyOf(fields);
        }

        public record Field(String name, Pat pattern) {
            public Field {
                Objects.requireNonNull(name, "name");
                Objects.requireNonNull(pattern, "pattern");
            }
        }
    }

    /** Matches an array of exactly {@code items.size()} elements. */
    record ArrayPat(List<Pat> items, SourcePos pos) implements Pat {
        public ArrayPat {
            Objects.requireNonNull(items, "items");
            Objects.requireNonNull(pos, "pos");
            items = List.copyOf(items);
        }
    }

    /** True if the pattern matches every value (so a {@code cond} arm using it is a default). */
    static boolean isIrrefutable(Pat pat) {
        return pat instanceof Wildcard || pat instanceof Binding;
    }
}
