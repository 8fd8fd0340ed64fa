package dev.sint.bytecode;

public final class AsmParseException extends Exception {
    private final int line;

    public AsmParseException(String message, int line) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    /** 1-based line number. */
    public int line() {
        return line;
    }
}
