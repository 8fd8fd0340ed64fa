package dev.sint.bytecode;

public final class VerifyException extends Exception {
    public VerifyException(String message) {
        super(message);
    }
}
