package dev.sint.vm;

public sealed class VmError extends Exception permits VmError.InvalidState, VmError.InvalidProgram {
    VmError(String message) {
        super(message);
    }

    public static final class InvalidState extends VmError {
        public InvalidState(String message) {
            super(message);
        }
    }

    public static final class InvalidProgram extends VmError {
        public InvalidProgram(String message) {
            super(message);
        }
    }
}
