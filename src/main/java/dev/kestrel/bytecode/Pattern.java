package dev.kestrel.bytecode;

import java.util.List;
import java.util.Objects;

/**
 * Compiled pattern.
 *
 * <p>{@link Bind} carries no name: a successful match yields the bound values in left-to-right
 * order and {@link Instruction.TestPattern#bindSlots()} says where each one goes.</p>
 */
public sealed interface Pattern
        permits Pattern.Wildcard, Pattern.Bind, Pattern.Literal, Pattern.Destructure, Pattern.Array {
    record Wildcard() implements Pattern {}

    record Bind() implements Pattern {}

    record Literal(ConstValue value) implements Pattern {
        public Literal {
            Objects.requireNonNull(value, "value");
            if (!ConstValue.isLiteral(value)) {
                throw new IllegalArgumentException("literal pattern needs a literal constant, got " + value);
            }
        }
    }

    /** Record with at least these fields, each matching its sub-pattern. */
    record Destructure(List<Field> fields) implements Pattern {
        public Destructure {
            Objects.requireNonNull(fields, "fields");
            fields = List.copyOf(fields);
        }

        public record Field(String name, Pattern pattern) {
            public Field {
                Objects.requireNonNull(name, "name");
                Objects.requireNonNull(pattern, "pattern");
            }
        }
    }

    /** Array of exactly {@code items.size()} elements. */
    record Array(List<Pattern> items) implements Pattern {
        public Array {
            Objects.requireNonNull(items, "items");
            items = List.copyOf(items);
        }
    }

    static int countBinds(Pattern p) {
        if (p instanceof Bind) {
            return 1;
        }
        if (p instanceof Destructure r) {
            int n = 0;
            for (Destructure.Field f : r.fields()) {
                n += countBinds(f.pattern());
            }
            return n;
        }
        if (p instanceof Array a) {
            int n = 0;
            for (Pattern item : a.items()) {
                n += countBinds(item);
            }
            return n;
        }
        return 0;
    }
}
