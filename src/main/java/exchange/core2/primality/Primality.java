package exchange.core2.primality;

/**
 * Static entry points backed by a shared tester with the default base sets.
 */
public final class Primality {

    private static final PrimalityTester DEFAULT_TESTER = PrimalityTester.createDefault();

    private Primality() {
    }

    public static boolean isPrime(final long n) {
        return DEFAULT_TESTER.isPrime(n);
    }

    public static PrimalityVerdict verdict(final long n) {
        return DEFAULT_TESTER.verdict(n);
    }
}
