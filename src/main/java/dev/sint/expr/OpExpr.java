package dev.sint.expr;

import dev.sint.bytecode.Instruction;
import dev.sint.bytecode.Opcode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Wraps one target opcode, its immediates and the operand nodes evaluated, in order, before it.
 *
 * <p>The node computes nothing itself. Its output type is whatever the caller declares.</p>
 */
public record OpExpr(Opcode op, List<Long> immediates, StackType type, List<Expr> operands) implements Expr {
    public OpExpr {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(immediates, "immediates");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(operands, "operands");
        immediates = List.copyOf(immediates);
        operands = List.copyOf(operands);
        if (op.isBranch() || op.isPseudo()) {
            throw new CodegenException.TypeMismatch("`" + op.mnemonic() + "` cannot be wrapped in a node");
        }
        if (immediates.size() != op.immediateCount()) {
            throw new CodegenException.TypeMismatch(
                    "`" + op.mnemonic() + "` expects " + op.immediateCount() + " immediate(s), got " + immediates.size());
        }
        try {
            Instruction.of(op, immediates);
        } catch (IllegalArgumentException e) {
            throw new CodegenException.OutOfRange(op.mnemonic() + ": " + e.getMessage());
        }
    }

    public static OpExpr of(Opcode op, StackType type, Expr... operands) {
        return new OpExpr(op, List.of(), type, List.of(operands));
    }

    public static OpExpr withImmediate(Opcode op, long immediate, StackType type, Expr... operands) {
        return new OpExpr(op, List.of(immediate), type, List.of(operands));
    }

    /** Push-constant node for a raw 64-bit word. */
    public static OpExpr pushInt(long word) {
        return withImmediate(Opcode.PUSH_INT, word, StackType.UINT64);
    }

    /** The instruction this node emits after its operands. */
    public Instruction instruction() {
        return Instruction.of(op, immediates);
    }

    /** The pushed word if this node is a bare constant push. */
    public Optional<Long> literalValue() {
        if (op == Opcode.PUSH_INT && operands.isEmpty()) {
            return Optional.of(immediates.get(0));
        }
        return Optional.empty();
    }
}
