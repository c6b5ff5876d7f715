package dev.kestrel.object;

/**
 * A VM value: an immediate (nil, bool, integer, float, host function) or a reference into the
 * collected heap.
 *
 * <p>References are arena slot indices tagged with the generation of the object that occupied
 * the slot when the reference was created, so a reference that outlives its object is detected
 * instead of silently aliasing a later allocation.</p>
 */
public sealed interface Value permits Value.Nil, Value.Bool, Value.Int, Value.Float, Value.Ref, Value.Host {
    Nil NIL = new Nil();
    Bool TRUE = new Bool(true);
    Bool FALSE = new Bool(false);

    String kind();

    default boolean isNumber() {
        return this instanceof Int || this instanceof Float;
    }

    static Bool of(boolean b) {
        return b ? TRUE : FALSE;
    }

    static Int of(long n) {
        return new Int(n);
    }

    static Float of(double x) {
        return new Float(x);
    }

    record Nil() implements Value {
        @Override
        public String kind() {
            return "nil";
        }

        @Override
        public String toString() {
            return "nil";
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String kind() {
            return "bool";
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record Int(long value) implements Value {
        @Override
        public String kind() {
            return "int";
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Float(double value) implements Value {
        @Override
        public String kind() {
            return "float";
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record Ref(int index, int generation) implements Value {
        public Ref {
            if (index < 0) {
                throw new IllegalArgumentException("heap index must be non-negative");
            }
        }

        @Override
        public String kind() {
            return "ref";
        }

        @Override
        public String toString() {
            return "#" + index + "." + generation;
        }
    }

    /** A host-provided function, by host import index. */
    record Host(int importIndex) implements Value {
        public Host {
            if (importIndex < 0) {
                throw new IllegalArgumentException("host import index must be non-negative");
            }
        }

        @Override
        public String kind() {
            return "host";
        }
    }
}
