package dev.sint.expr;

/** Errors raised while building a node tree. No partial tree is ever returned. */
public sealed class CodegenException extends RuntimeException
        permits CodegenException.OutOfRange, CodegenException.NotAnInteger, CodegenException.TypeMismatch {
    CodegenException(String message) {
        super(message);
    }

    /** A literal or immediate lies outside the range its use allows. */
    public static final class OutOfRange extends CodegenException {
        public OutOfRange(String message) {
            super(message);
        }
    }

    /** A value that must be an integer literal is not one. */
    public static final class NotAnInteger extends CodegenException {
        public NotAnInteger(String message) {
            super(message);
        }
    }

    /** Declared types or immediates do not fit the node being built. */
    public static final class TypeMismatch extends CodegenException {
        public TypeMismatch(String message) {
            super(message);
        }
    }
}
