package dev.sint.bytecode;

public final class BytecodeEncodeException extends Exception {
    public BytecodeEncodeException(String message) {
        super(message);
    }
}
