package dev.kestrel.gc;

/** Outcome of one mark-sweep cycle. */
public record GcCycle(
        int cycle,
        int objectsMarked,
        int objectsFreed,
        long bytesFreed,
        long liveBytes,
        long nextThreshold,
        long elapsedNanos) {}
