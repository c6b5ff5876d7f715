package dev.kestrel.vm;

import java.util.Objects;

public sealed interface StepResult permits StepResult.Done, StepResult.Trap, StepResult.Yield {
    record Done(HostValue value) implements StepResult {
        public Done {
            Objects.requireNonNull(value, "value");
        }
    }

    record Trap(RuntimeError error) implements StepResult {
        public Trap {
            Objects.requireNonNull(error, "error");
        }

        public String message() {
            return error.message();
        }
    }

    /** Fuel ran out; call {@link Vm#step} again to continue. */
    record Yield(long remainingFuel) implements StepResult {}
}
