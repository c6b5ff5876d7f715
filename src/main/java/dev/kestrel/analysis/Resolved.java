package dev.kestrel.analysis;

import java.util.Objects;

/**
 * Where a name use finds its binding, seen from the function containing the use.
 *
 * <p>Also used for capture lists: entry {@code i} of {@link FunctionInfo#captures()} says how
 * the enclosing function reaches the variable that becomes upvalue {@code i}.</p>
 */
public sealed interface Resolved permits Resolved.Local, Resolved.Upvalue, Resolved.Global, Resolved.Host {
    Symbol symbol();

    record Local(Symbol symbol) implements Resolved {
        public Local {
            Objects.requireNonNull(symbol, "symbol");
        }
    }

    record Upvalue(int index, Symbol symbol) implements Resolved {
        public Upvalue {
            Objects.requireNonNull(symbol, "symbol");
        }
    }

    record Global(Symbol symbol) implements Resolved {
        public Global {
            Objects.requireNonNull(symbol, "symbol");
        }
    }

    record Host(Symbol symbol) implements Resolved {
        public Host {
            Objects.requireNonNull(symbol, "symbol");
        }
    }
}
