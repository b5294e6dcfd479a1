package exchange.core2.primality.arithmetic;

/**
 * Modular multiplication and exponentiation over non-negative signed longs.
 * <p>
 * Java has no 128-bit integer type, so products of operands above 2^32 are reduced
 * piecewise: operands are split into 32-bit halves and the partial products are folded
 * back with unsigned remainders. Nothing here allocates.
 */
public final class ModularArithmetic {

    /**
     * floor(sqrt(Long.MAX_VALUE)) - for moduli up to this value a*b fits into a signed long
     */
    public static final long FLOOR_SQRT_MAX_LONG = 3037000499L;

    private static final long LOW_32_MASK = 0xFFFF_FFFFL;

    private ModularArithmetic() {
    }

    /**
     * Returns (a * b) mod m.
     * <p>
     * Arguments are not checked: {@code 0 <= a, b < m} and {@code m >= 1} must hold.
     */
    public static long mulMod(final long a, final long b, final long m) {

        if (m <= FLOOR_SQRT_MAX_LONG) {
            return (a * b) % m;
        }

        final long aHi = a >>> 32; // < 2^31
        final long bHi = b >>> 32; // < 2^31
        final long aLo = a & LOW_32_MASK;
        final long bLo = b & LOW_32_MASK;

        // a*b = ((aHi*bHi * 2^32) + aHi*bLo + aLo*bHi) * 2^32 + aLo*bLo
        long result = times2ToThe32Mod(aHi * bHi, m); // < m < 2^63
        result += aHi * bLo; // < 2^64 as unsigned
        if (result < 0) {
            result = Long.remainderUnsigned(result, m);
        }
        result += aLo * bHi; // < 2^64 as unsigned
        result = times2ToThe32Mod(result, m);

        return plusMod(result, Long.remainderUnsigned(aLo * bLo, m), m);
    }

    /**
     * Returns (a * a) mod m, same preconditions as {@link #mulMod(long, long, long)}.
     */
    public static long squareMod(final long a, final long m) {
        return mulMod(a, a, m);
    }

    /**
     * Double-and-add modular multiplication. Slower than {@link #mulMod(long, long, long)}
     * (one addition per bit of b) but only ever adds two values below m.
     *
     * @throws IllegalArgumentException if m < 1 or a, b are negative
     */
    public static long mulModDoubleAndAdd(long a, long b, final long m) {

        checkModulus(m);
        if (a < 0 || b < 0) {
            throw new IllegalArgumentException("Operands must be non-negative: a=" + a + " b=" + b);
        }

        a %= m;
        long result = 0L;
        while (b != 0) {
            if ((b & 1L) != 0) {
                result = plusMod(result, a, m);
            }
            a = plusMod(a, a, m);
            b >>>= 1;
        }
        return result;
    }

    /**
     * Returns (a ^ e) mod m using right-to-left binary exponentiation.
     * The base is reduced modulo m first, so any non-negative base is accepted.
     *
     * @throws IllegalArgumentException if m < 1, e < 0 or a < 0
     */
    public static long powMod(long a, long e, final long m) {

        checkModulus(m);
        if (e < 0) {
            throw new IllegalArgumentException("Exponent must be non-negative: " + e);
        }
        if (a < 0) {
            throw new IllegalArgumentException("Base must be non-negative: " + a);
        }

        a %= m;
        long result = 1L % m;
        while (e != 0) {
            if ((e & 1L) != 0) {
                result = mulMod(result, a, m);
            }
            a = squareMod(a, m);
            e >>>= 1;
        }
        return result;
    }

    /**
     * Returns (a + b) mod m for {@code 0 <= a, b < m}.
     */
    static long plusMod(final long a, final long b, final long m) {
        return (a >= m - b) ? (a + b - m) : (a + b);
    }

    /**
     * Returns (a * 2^32) mod m, a is treated as unsigned.
     */
    static long times2ToThe32Mod(long a, final long m) {
        int remainingShift = 32;
        do {
            // shift as far as the free high bits allow, then reduce
            final int shift = Math.min(remainingShift, Long.numberOfLeadingZeros(a));
            a = Long.remainderUnsigned(a << shift, m);
            remainingShift -= shift;
        } while (remainingShift > 0);
        return a;
    }

    private static void checkModulus(final long m) {
        if (m < 1) {
            throw new IllegalArgumentException("Modulus must be positive: " + m);
        }
    }
}
