package dev.sint.expr;

/** Declared output type of a node. */
public enum StackType {
    UINT64,
    NONE
}
