package dev.kestrel.gc;

/** An allocation would push the heap past {@link HeapConfig#maxHeapBytes()}. */
public final class HeapExhaustedException extends Exception {
    private final long requestedBytes;

    HeapExhaustedException(long requestedBytes, long bytesInUse, long maxHeapBytes) {
        super(
                "cannot allocate "
                        + requestedBytes
                        + " bytes: "
                        + bytesInUse
                        + " of "
                        + maxHeapBytes
                        + " bytes in use");
        this.requestedBytes = requestedBytes;
    }

    public long requestedBytes() {
        return requestedBytes;
    }
}
