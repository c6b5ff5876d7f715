package dev.kestrel.vm;

import java.util.List;

@FunctionalInterface
public interface HostFn {
    /** A thrown exception halts the VM with a {@link RuntimeErrorKind#TYPE_ERROR}. */
    HostValue call(List<HostValue> args) throws Exception;
}
