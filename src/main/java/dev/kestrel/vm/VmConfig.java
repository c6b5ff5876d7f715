package dev.kestrel.vm;

import dev.kestrel.gc.HeapConfig;
import java.util.Objects;

/**
 * @param maxFrames call depth limit; exceeding it is a stack overflow
 * @param maxStack operand stack limit in slots, locals included
 */
public record VmConfig(int maxFrames, int maxStack, HeapConfig heap) {
    public static final int DEFAULT_MAX_FRAMES = 1024;
    public static final int DEFAULT_MAX_STACK = 1 << 20;

    public VmConfig {
        Objects.requireNonNull(heap, "heap");
        if (maxFrames <= 0) {
            throw new IllegalArgumentException("maxFrames must be > 0");
        }
        if (maxStack <= 0) {
            throw new IllegalArgumentException("maxStack must be > 0");
        }
    }

    public static VmConfig defaults() {
        return new VmConfig(DEFAULT_MAX_FRAMES, DEFAULT_MAX_STACK, HeapConfig.defaults());
    }

    public VmConfig withMaxFrames(int frames) {
        return new VmConfig(frames, maxStack, heap);
    }

    public VmConfig withHeap(HeapConfig heapConfig) {
        return new VmConfig(maxFrames, maxStack, heapConfig);
    }
}
