package dev.sint.vm;

import java.util.Objects;

public sealed interface StepResult permits StepResult.Done, StepResult.Trap, StepResult.Yield {
    /** The program finished with exactly one word on the stack. */
    record Done(long value) implements StepResult {}

    /** The program aborted; nothing after the failing instruction ran. */
    record Trap(String message) implements StepResult {
        public Trap {
            Objects.requireNonNull(message, "message");
        }
    }

    record Yield(long remainingFuel) implements StepResult {}
}
