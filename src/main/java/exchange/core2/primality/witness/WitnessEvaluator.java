package exchange.core2.primality.witness;

import exchange.core2.primality.arithmetic.ModularArithmetic;
import org.jetbrains.annotations.NotNull;

/**
 * Single-base strong probable prime check.
 * <p>
 * A base a is a witness for n when neither a^d == 1 nor a^(d * 2^r) == n-1 (mod n) for
 * some 0 <= r < s. A witness proves n composite; a non-witness only means n is prime or a
 * strong pseudoprime to that base.
 */
public final class WitnessEvaluator {

    private WitnessEvaluator() {
    }

    /**
     * @param a base, 2 <= a < n
     * @param d odd part of n-1
     * @param n odd candidate, n >= 3
     * @param s number of factors of two in n-1, s >= 1
     * @return true if a proves n composite
     */
    public static boolean isWitnessComposite(final long a, final long d, final long n, final int s) {

        final long nMinusOne = n - 1;

        long x = ModularArithmetic.powMod(a, d, n);
        if (x == 1 || x == nMinusOne) {
            return false;
        }

        for (int r = 1; r < s; r++) {
            x = ModularArithmetic.squareMod(x, n);
            if (x == nMinusOne) {
                return false;
            }
            if (x == 1) {
                // non-trivial square root of 1
                return true;
            }
        }

        return true;
    }

    public static boolean isWitnessComposite(final long a, @NotNull final Decomposition decomposition, final long n) {
        return isWitnessComposite(a, decomposition.getD(), n, decomposition.getS());
    }
}
