package dev.kestrel.gc;

/**
 * Collector tuning.
 *
 * @param initialThresholdBytes bytes to allocate before the first collection; also the floor
 *     of every later threshold
 * @param growthFactor after a cycle the next threshold is {@code liveBytes * growthFactor}
 * @param maxHeapBytes hard limit on live plus not-yet-swept bytes
 */
public record HeapConfig(long initialThresholdBytes, double growthFactor, long maxHeapBytes) {
    public static final long DEFAULT_INITIAL_THRESHOLD = 256 * 1024;
    public static final double DEFAULT_GROWTH_FACTOR = 2.0;
    public static final long DEFAULT_MAX_HEAP = 64L * 1024 * 1024;

    public HeapConfig {
        if (initialThresholdBytes <= 0) {
            throw new IllegalArgumentException("initialThresholdBytes must be > 0");
        }
        if (!(growthFactor >= 1.0)) {
            throw new IllegalArgumentException("growthFactor must be >= 1.0");
        }
        if (maxHeapBytes < initialThresholdBytes) {
            throw new IllegalArgumentException("maxHeapBytes must be >= initialThresholdBytes");
        }
    }

    public static HeapConfig defaults() {
        return new HeapConfig(DEFAULT_INITIAL_THRESHOLD, DEFAULT_GROWTH_FACTOR, DEFAULT_MAX_HEAP);
    }

    public HeapConfig withInitialThreshold(long bytes) {
        return new HeapConfig(bytes, growthFactor, Math.max(maxHeapBytes, bytes));
    }

    public HeapConfig withMaxHeap(long bytes) {
        return new HeapConfig(Math.min(initialThresholdBytes, bytes), growthFactor, bytes);
    }
}
