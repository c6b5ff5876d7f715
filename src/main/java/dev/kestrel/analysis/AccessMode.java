package dev.kestrel.analysis;

/** How one use site touches a binding. */
enum AccessMode {
    READ,
    SHARED_BORROW,
    EXCLUSIVE_BORROW,
    MOVE,
    WRITE;

    boolean isExclusive() {
        return this == EXCLUSIVE_BORROW || this == MOVE || this == WRITE;
    }
}
