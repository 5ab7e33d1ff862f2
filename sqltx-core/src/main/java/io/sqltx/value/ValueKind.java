package io.sqltx.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Classification of a dynamic value for binding as a statement parameter.
 *
 * <p>{@link #of(Object)} applies a fixed order: null, text, integer, float, boolean, other.
 * A number that is representable both as an integer and as a float (for example
 * {@code 3.0d}) classifies as {@link #INTEGER} because the integer check runs first.
 */
public enum ValueKind {
    /** SQL NULL, bound typed as text. */
    NULL,
    /** Bound as a character string. */
    TEXT,
    /** Bound as a 64-bit signed integer. */
    INTEGER,
    /** Bound as a 64-bit float. */
    FLOAT,
    /** Bound as a boolean. */
    BOOLEAN,
    /** Anything else; bound as its canonical JSON text. */
    OTHER;

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    /**
     * Classifies a parameter value.
     *
     * @param value any value, possibly {@code null}
     * @return its kind, never {@code null}
     */
    public static ValueKind of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return TEXT;
        }
        if (value instanceof Number number) {
            return isIntegral(number) ? INTEGER : FLOAT;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        return OTHER;
    }

    /**
     * Returns the exact 64-bit value of a number classified as {@link #INTEGER}.
     *
     * @throws IllegalArgumentException if the number is not integer-valued or out of range
     */
    public static long toLong(Number number) {
        if (!isIntegral(number)) {
            throw new IllegalArgumentException("Not a 64-bit integer value: " + number);
        }
        if (number instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.longValueExact();
        }
        if (number instanceof Double || number instanceof Float) {
            return (long) number.doubleValue();
        }
        return number.longValue();
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short
                || number instanceof Byte || number instanceof AtomicLong || number instanceof AtomicInteger) {
            return true;
        }
        if (number instanceof BigInteger big) {
            return big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0;
        }
        if (number instanceof BigDecimal decimal) {
            try {
                decimal.longValueExact();
                return true;
            } catch (ArithmeticException e) {
                return false;
            }
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            // 2^63 itself is out of range, so the upper bound is exclusive
            return !Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d)
                    && d >= -0x1p63 && d < 0x1p63;
        }
        return false;
    }
}
