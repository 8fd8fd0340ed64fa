package dev.sint.arith;

import dev.sint.bytecode.Opcode;
import dev.sint.expr.CodegenException;
import dev.sint.expr.CondExpr;
import dev.sint.expr.Expr;
import dev.sint.expr.OpExpr;
import dev.sint.expr.StackType;
import java.util.Objects;
import java.util.Optional;

/**
 * Builders for signed 64-bit arithmetic over the unsigned-word machine.
 *
 * <p>Every operand node is placed in the result tree exactly once; values needed twice are
 * copied on the stack with {@code dup}. Each builder yields a node that needs nothing below it
 * on the stack and leaves exactly one word.</p>
 *
 * <p>Overflow checks are always emitted: the operands are arbitrary nodes whose values are not
 * known until the program runs.</p>
 */
public final class SignedArith {
    private final CompileOptions options;

    public SignedArith(CompileOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public static SignedArith withDefaults() {
        return new SignedArith(CompileOptions.defaults());
    }

    public CompileOptions options() {
        return options;
    }

    /**
     * Overflow-checked {@code a + b}.
     *
     * <p>The low word of the unsigned wide sum is the two's-complement sum. The carry word is
     * dropped. The program aborts unless {@code (sA ^ sB) | !(sA ^ sR)}, where {@code sR} is
     * the sign of the result.</p>
     */
    public Expr buildAdd(Expr a, Expr b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");

        Expr s = signOfTop(a);                 // a sA
        s = op(Opcode.SWAP, s);                // sA a
        s = op(Opcode.DUP, s, b);              // sA a b b
        s = op(Opcode.GET_BIT, s, signBit());  // sA a b sB
        s = imm(Opcode.UNCOVER, 3, s);         // a b sB sA
        s = op(Opcode.DUP, s);                 // a b sB sA sA
        s = imm(Opcode.COVER, 4, s);           // sA a b sB sA
        s = op(Opcode.BIT_XOR, s);             // sA a b signsDiffer
        s = imm(Opcode.COVER, 3, s);           // signsDiffer sA a b
        s = op(Opcode.ADDW, s);                // signsDiffer sA carry sum
        s = imm(Opcode.COVER, 2, s);           // signsDiffer sum sA carry
        s = op(Opcode.POP, s);                 // signsDiffer sum sA
        s = op(Opcode.SWAP, s);                // signsDiffer sA sum
        s = op(Opcode.DUP, s);                 // signsDiffer sA sum sum
        s = op(Opcode.GET_BIT, s, signBit());  // signsDiffer sA sum sR
        s = imm(Opcode.UNCOVER, 2, s);         // signsDiffer sum sR sA
        s = op(Opcode.BIT_XOR, s);             // signsDiffer sum signChanged
        s = op(Opcode.NOT, s);                 // signsDiffer sum signKept
        s = imm(Opcode.UNCOVER, 2, s);         // sum signKept signsDiffer
        s = op(Opcode.OR, s);                  // sum ok
        return op(Opcode.ASSERT, s);           // sum
    }

    /** Overflow-checked {@code a - b}, as {@code a + (-b)}. */
    public Expr buildSub(Expr a, Expr b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return buildAdd(a, buildNegate(b));
    }

    /**
     * Two's-complement negation {@code (x ^ ~0) + 1}, with the carry of the wide add dropped.
     *
     * <p>Under {@link CompileOptions.MinValueNegation#TRAP} the program aborts when {@code x} is
     * {@code -2^63}, so subtracting {@code -2^63} always aborts. Under
     * {@link CompileOptions.MinValueNegation#WRAP} that input comes back unchanged.</p>
     */
    public Expr buildNegate(Expr x) {
        Objects.requireNonNull(x, "x");

        Expr s = x;
        if (options.negation() == CompileOptions.MinValueNegation.TRAP) {
            s = op(Opcode.DUP, s);                                            // x x
            s = op(Opcode.EQ, s, OpExpr.pushInt(SignedWords.MIN_VALUE_WORD)); // x isMin
            s = op(Opcode.NOT, s);
            s = op(Opcode.ASSERT, s);                                         // x
        }
        s = op(Opcode.BIT_XOR, s, OpExpr.pushInt(SignedWords.ALL_ONES)); // ~x
        s = op(Opcode.ADDW, s, OpExpr.pushInt(1));                       // carry low
        s = op(Opcode.SWAP, s);
        return op(Opcode.POP, s);
    }

    /**
     * Arithmetic right shift by a literal amount.
     *
     * @throws CodegenException.OutOfRange unless {@code 0 <= k <= 63}
     */
    public Expr buildShiftRight(Expr a, int k) {
        if (k < 0 || k > 63) {
            throw new CodegenException.OutOfRange("shift amount must be in 0..63, got " + k);
        }
        return buildShiftRight(a, OpExpr.pushInt(k));
    }

    /**
     * Arithmetic right shift: {@code floor(a / 2^k)}.
     *
     * <p>The logical shift {@code a >> k} is ORed with {@code ~(~0 >> k)} when {@code a} is
     * negative, and with {@code 0} otherwise. That mask is {@code 0} for {@code k = 0}, so the
     * target never sees a shift by 64.</p>
     *
     * <p>A literal {@code k} is checked here. Any other {@code k} is checked at run time
     * unless {@link CompileOptions#guardShiftAmount()} is off.</p>
     *
     * @throws CodegenException.OutOfRange if {@code k} is a literal greater than 63
     */
    public Expr buildShiftRight(Expr a, Expr k) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(k, "k");

        Optional<Long> literal = literalOf(k);
        Expr amount = k;
        if (literal.isPresent()) {
            if (Long.compareUnsigned(literal.get(), 63) > 0) {
                throw new CodegenException.OutOfRange(
                        "shift amount must be in 0..63, got " + Long.toUnsignedString(literal.get()));
            }
        } else if (options.guardShiftAmount()) {
            amount = op(Opcode.DUP, amount);                                // k k
            amount = op(Opcode.SHR, amount, OpExpr.pushInt(6));             // k (k >> 6)
            amount = op(Opcode.NOT, amount);
            amount = op(Opcode.ASSERT, amount);                             // k
        }

        Expr s = signOfTop(a);                 // a sA
        s = op(Opcode.SWAP, s);                // sA a
        s = op(Opcode.DUP, s, amount);         // sA a k k
        s = imm(Opcode.COVER, 2, s);           // sA k a k
        s = op(Opcode.SHR, s);                 // sA k shifted
        s = imm(Opcode.COVER, 2, s);           // shifted sA k
        s = op(Opcode.SWAP, s);                // shifted k sA

        // Both arms consume k and leave one word.
        Expr mask = OpExpr.pushInt(SignedWords.ALL_ONES); // shifted k ~0
        mask = op(Opcode.SWAP, mask);                      // shifted ~0 k
        mask = op(Opcode.SHR, mask);                       // shifted (~0 >> k)
        mask = op(Opcode.BIT_NOT, mask);                   // shifted mask
        Expr zero = OpExpr.withImmediate(
                Opcode.PUSH_INT, 0, StackType.UINT64, OpExpr.of(Opcode.POP, StackType.NONE));

        return op(Opcode.BIT_OR, new CondExpr(s, mask, zero));
    }

    /** Evaluates {@code x} and pushes its sign bit above it. */
    private static Expr signOfTop(Expr x) {
        return op(Opcode.GET_BIT, op(Opcode.DUP, x), signBit());
    }

    private static OpExpr signBit() {
        return OpExpr.pushInt(SignedWords.SIGN_BIT);
    }

    private static Optional<Long> literalOf(Expr e) {
        return e instanceof OpExpr op ? op.literalValue() : Optional.empty();
    }

    private static OpExpr op(Opcode opcode, Expr... operands) {
        return OpExpr.of(opcode, StackType.UINT64, operands);
    }

    private static OpExpr imm(Opcode opcode, long immediate, Expr... operands) {
        return OpExpr.withImmediate(opcode, immediate, StackType.UINT64, operands);
    }
}
