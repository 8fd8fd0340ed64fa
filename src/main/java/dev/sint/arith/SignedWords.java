package dev.sint.arith;

import dev.sint.expr.CodegenException;
import dev.sint.expr.OpExpr;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Two's-complement mapping between signed 64-bit integers and the target's unsigned words.
 *
 * <p>A word is carried in a Java {@code long}; its bits are the target bits, so
 * {@link Long#toUnsignedString(long)} shows the value the target sees.</p>
 */
public final class SignedWords {
    /** Word of the most negative signed value, {@code -2^63}. */
    public static final long MIN_VALUE_WORD = 0x8000_0000_0000_0000L;

    /** {@code 2^64 - 1}. */
    public static final long ALL_ONES = 0xFFFF_FFFF_FFFF_FFFFL;

    public static final int SIGN_BIT = 63;

    static final BigInteger MIN = BigInteger.ONE.shiftLeft(63).negate();
    static final BigInteger MAX = BigInteger.ONE.shiftLeft(63).subtract(BigInteger.ONE);

    private static final BigInteger TWO_POW_64 = BigInteger.ONE.shiftLeft(64);
    private static final BigInteger WORD_MASK = TWO_POW_64.subtract(BigInteger.ONE);

    private SignedWords() {}

    /**
     * Encodes {@code n} into its unsigned word.
     *
     * @throws CodegenException.OutOfRange if {@code n} is outside {@code [-2^63, 2^63-1]}
     */
    public static long encode(BigInteger n) {
        Objects.requireNonNull(n, "n");
        if (n.compareTo(MIN) < 0 || n.compareTo(MAX) > 0) {
            throw new CodegenException.OutOfRange(
                    "value " + n + " outside of 64-bit signed range [" + MIN + ", " + MAX + "]");
        }
        if (n.signum() >= 0) {
            return n.longValue();
        }
        return n.abs().xor(WORD_MASK).add(BigInteger.ONE).mod(TWO_POW_64).longValue();
    }

    public static long encode(long n) {
        return encode(BigInteger.valueOf(n));
    }

    /**
     * Encodes a boxed integer.
     *
     * @throws CodegenException.NotAnInteger for floating-point values and fractional decimals
     * @throws CodegenException.OutOfRange if the value is outside the signed range
     */
    public static long encode(Number n) {
        Objects.requireNonNull(n, "n");
        return encode(toBigInteger(n));
    }

    /** Signed value of a word: bit 63 is the sign. */
    public static long decode(long word) {
        return decodeToBigInteger(word).longValueExact();
    }

    public static BigInteger decodeToBigInteger(long word) {
        BigInteger unsigned = unsignedValue(word);
        return isNegative(word) ? unsigned.subtract(TWO_POW_64) : unsigned;
    }

    /**
     * Signed value of a word given as an unsigned integer.
     *
     * @throws CodegenException.OutOfRange if {@code word} is outside {@code [0, 2^64-1]}
     */
    public static BigInteger decode(BigInteger word) {
        Objects.requireNonNull(word, "word");
        if (word.signum() < 0 || word.compareTo(WORD_MASK) > 0) {
            throw new CodegenException.OutOfRange("word " + word + " outside of [0, " + WORD_MASK + "]");
        }
        return decodeToBigInteger(word.longValue());
    }

    public static BigInteger unsignedValue(long word) {
        return new BigInteger(Long.toUnsignedString(word));
    }

    public static boolean isNegative(long word) {
        return (word >>> SIGN_BIT) != 0;
    }

    /** Push-constant node for the encoded form of {@code n}. */
    public static OpExpr literal(Number n) {
        return OpExpr.pushInt(encode(n));
    }

    public static OpExpr literal(long n) {
        return OpExpr.pushInt(encode(n));
    }

    private static BigInteger toBigInteger(Number n) {
        if (n instanceof BigInteger b) {
            return b;
        }
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return BigInteger.valueOf(n.longValue());
        }
        if (n instanceof BigDecimal d) {
            try {
                return d.toBigIntegerExact();
            } catch (ArithmeticException e) {
                throw new CodegenException.NotAnInteger("expected an integer, got decimal " + d.toPlainString());
            }
        }
        throw new CodegenException.NotAnInteger(
                "expected an integer, got " + n.getClass().getSimpleName() + " " + n);
    }
}
