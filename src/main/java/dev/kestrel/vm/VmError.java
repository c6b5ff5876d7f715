package dev.kestrel.vm;

/** The VM cannot be set up or driven as requested; nothing ran. */
public sealed class VmError extends Exception permits VmError.InvalidState {
    VmError(String message) {
        super(message);
    }

    public static final class InvalidState extends VmError {
        public InvalidState(String message) {
            super(message);
        }
    }
}
