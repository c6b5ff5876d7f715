package dev.kestrel.vm;

sealed interface VmState permits VmState.Running, VmState.Done, VmState.Trapped {
    record Running() implements VmState {}

    record Done(HostValue value) implements VmState {}

    record Trapped(RuntimeError error) implements VmState {}
}
