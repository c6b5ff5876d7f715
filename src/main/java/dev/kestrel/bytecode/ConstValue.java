package dev.kestrel.bytecode;

import java.util.Objects;

/** Constant pool entry. */
public sealed interface ConstValue
        permits ConstValue.Nil,
                ConstValue.Bool,
                ConstValue.Int,
                ConstValue.Float,
                ConstValue.Str,
                ConstValue.MatchPattern,
                ConstValue.Function {
    record Nil() implements ConstValue {}

    record Bool(boolean value) implements ConstValue {}

    record Int(long value) implements ConstValue {}

    record Float(double value) implements ConstValue {}

    record Str(String value) implements ConstValue {
        public Str {
            Objects.requireNonNull(value, "value");
        }
    }

    /** A compiled pattern, consumed by {@link Instruction.TestPattern}. */
    record MatchPattern(Pattern pattern) implements ConstValue {
        public MatchPattern {
            Objects.requireNonNull(pattern, "pattern");
        }
    }

    /** A function template, instantiated by {@link Instruction.MakeClosure}. */
    record Function(FunctionId value) implements ConstValue {
        public Function {
            Objects.requireNonNull(value, "value");
        }
    }

    /** True for constants that {@link Instruction.PushConst} may push and literal patterns may hold. */
    static boolean isLiteral(ConstValue c) {
        return c instanceof Nil || c instanceof Bool || c instanceof Int || c instanceof Float || c instanceof Str;
    }
}
