package dev.sint.expr;

/**
 * Immutable compile-time expression node.
 *
 * <p>Nodes are built once and handed to {@link ExprLowering}. A node object placed at two
 * positions of a tree is emitted, and therefore evaluated, twice.</p>
 */
public sealed interface Expr permits OpExpr, CondExpr {
    StackType type();
}
