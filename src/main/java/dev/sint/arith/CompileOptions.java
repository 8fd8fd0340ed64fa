package dev.sint.arith;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Code generation settings for {@link SignedArith}.
 *
 * @param negation what negating {@code -2^63} does at run time
 * @param guardShiftAmount whether a shift amount that is not a literal gets a run-time {@code < 64} check
 */
public record CompileOptions(MinValueNegation negation, boolean guardShiftAmount) {
    public static final String RESOURCE = "sint-codegen.properties";
    public static final String KEY_NEGATION = "sint.negate.min-value";
    public static final String KEY_GUARD_SHIFT = "sint.shift.guard-amount";

    /** Policy for negating the most negative value, whose negation is not representable. */
    public enum MinValueNegation {
        /** Abort, the same way an overflowing addition does. */
        TRAP,
        /** Return the input unchanged, like plain two's-complement hardware. */
        WRAP
    }

    public CompileOptions {
        Objects.requireNonNull(negation, "negation");
    }

    public static CompileOptions defaults() {
        return new CompileOptions(MinValueNegation.TRAP, true);
    }

    public CompileOptions withNegation(MinValueNegation negation) {
        return new CompileOptions(negation, guardShiftAmount);
    }

    public CompileOptions withGuardShiftAmount(boolean guardShiftAmount) {
        return new CompileOptions(negation, guardShiftAmount);
    }

    /**
     * Reads options from properties; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a key has an unrecognized value
     */
    public static CompileOptions fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        CompileOptions out = defaults();

        String negation = props.getProperty(KEY_NEGATION);
        if (negation != null) {
            switch (negation.trim().toLowerCase(Locale.ROOT)) {
                case "trap" -> out = out.withNegation(MinValueNegation.TRAP);
                case "wrap" -> out = out.withNegation(MinValueNegation.WRAP);
                default -> throw new IllegalArgumentException(
                        KEY_NEGATION + ": expected `trap` or `wrap`, got `" + negation + "`");
            }
        }

        String guard = props.getProperty(KEY_GUARD_SHIFT);
        if (guard != null) {
            switch (guard.trim().toLowerCase(Locale.ROOT)) {
                case "true" -> out = out.withGuardShiftAmount(true);
                case "false" -> out = out.withGuardShiftAmount(false);
                default -> throw new IllegalArgumentException(
                        KEY_GUARD_SHIFT + ": expected `true` or `false`, got `" + guard + "`");
            }
        }
        return out;
    }

    /** Options from {@value #RESOURCE} on the classpath, or the defaults when it is absent. */
    public static CompileOptions load() {
        return load(CompileOptions.class.getClassLoader());
    }

    static CompileOptions load(ClassLoader loader) {
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + RESOURCE, e);
        }
    }
}
