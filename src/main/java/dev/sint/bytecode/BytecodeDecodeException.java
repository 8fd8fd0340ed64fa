package dev.sint.bytecode;

public final class BytecodeDecodeException extends Exception {
    private final int offset;

    public BytecodeDecodeException(String message, int offset) {
        super("decode error at " + offset + ": " + message);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
