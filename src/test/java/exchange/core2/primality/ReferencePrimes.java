package exchange.core2.primality;

import java.util.Arrays;

/**
 * Trial division reference, independent from the Miller-Rabin code under test.
 */
final class ReferencePrimes {

    private ReferencePrimes() {
    }

    static long[] firstPrimes(final int count) {

        final long[] primes = new long[count];
        int idx = 0;
        for (long x = 2; idx < count; x++) {
            if (isPrimeByTrialDivision(x)) {
                primes[idx++] = x;
            }
        }
        return primes;
    }

    static boolean isPrimeByTrialDivision(final long x) {

        if (x <= 3) {
            return x > 1;
        }

        if (x % 2 == 0 || x % 3 == 0) {
            return false;
        }

        // 6k - 1 and 6k + 1
        for (long d = 5; d * d <= x; d += 6) {
            if (x % d == 0 || x % (d + 2) == 0) {
                return false;
            }
        }
        return true;
    }

    static boolean[] sieve(final int limit) {
        final boolean[] prime = new boolean[limit + 1];
        Arrays.fill(prime, 2, limit + 1, true);
        for (int i = 2; (long) i * i <= limit; i++) {
            if (prime[i]) {
                for (int j = i * i; j <= limit; j += i) {
                    prime[j] = false;
                }
            }
        }
        return prime;
    }
}
