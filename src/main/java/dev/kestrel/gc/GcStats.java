package dev.kestrel.gc;

/** Cumulative collector counters since the heap was created. */
public record GcStats(
        int cycles,
        long objectsAllocated,
        long bytesAllocated,
        long objectsFreed,
        long bytesFreed,
        long peakBytesInUse) {}
