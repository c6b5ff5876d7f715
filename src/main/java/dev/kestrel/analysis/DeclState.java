package dev.kestrel.analysis;

/** Declared-state of a binding at a program point. Declaration order is the meet order. */
enum DeclState {
    UNINITIALIZED,
    MOVED,
    INITIALIZED;

    static DeclState meet(DeclState a, DeclState b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
