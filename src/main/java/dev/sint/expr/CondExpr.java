package dev.sint.expr;

import java.util.Objects;

/**
 * Value-producing conditional. The condition word is consumed; a non-zero word selects
 * {@code whenTrue}.
 *
 * <p>Both arms must declare the same type, even when one of them is a constant.</p>
 */
public record CondExpr(Expr condition, Expr whenTrue, Expr whenFalse) implements Expr {
    public CondExpr {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(whenTrue, "whenTrue");
        Objects.requireNonNull(whenFalse, "whenFalse");
        if (condition.type() != StackType.UINT64) {
            throw new CodegenException.TypeMismatch("condition must be " + StackType.UINT64 + ", got " + condition.type());
        }
        if (whenTrue.type() != whenFalse.type()) {
            throw new CodegenException.TypeMismatch(
                    "conditional arms differ in type: " + whenTrue.type() + " vs " + whenFalse.type());
        }
    }

    @Override
    public StackType type() {
        return whenTrue.type();
    }
}
