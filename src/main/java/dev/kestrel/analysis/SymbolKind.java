package dev.kestrel.analysis;

public enum SymbolKind {
    /** A slot in a function's local window; {@link Symbol#index()} is the slot. */
    LOCAL,
    /** A top-level binding; {@link Symbol#index()} is the global table index. */
    GLOBAL,
    /** A host import; {@link Symbol#index()} is the host import index. */
    HOST
}
