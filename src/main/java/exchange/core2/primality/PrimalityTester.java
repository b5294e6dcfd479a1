package exchange.core2.primality;

import exchange.core2.primality.witness.Decomposition;
import exchange.core2.primality.witness.WitnessEvaluator;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Miller-Rabin primality test over a fixed, ordered list of bases.
 * <p>
 * With {@link PrimalityConfig#DEFAULT} the answer is exact for every signed 64-bit value:
 * {2..17} classifies all n below 341,550,071,728,321 correctly and {2..37} every n below 2^64.
 * Instances are immutable and can be shared between threads.
 */
public final class PrimalityTester {

    private static final Logger log = LoggerFactory.getLogger(PrimalityTester.class);

    private final PrimalityConfig config;

    private PrimalityTester(PrimalityConfig config) {
        this.config = config;
    }

    public static PrimalityTester create(@NotNull final PrimalityConfig config) {
        log.debug("Creating primality tester: {}", config);
        return new PrimalityTester(config);
    }

    public static PrimalityTester createDefault() {
        return create(PrimalityConfig.DEFAULT);
    }

    public boolean isPrime(final long n) {

        if (n < 2) {
            return false;
        }

        if ((n & 1L) == 0) {
            return n == 2;
        }

        final Decomposition decomposition = Decomposition.of(n);

        for (final long a : config.basesFor(n)) {
            if (a >= n) {
                continue;
            }
            if (WitnessEvaluator.isWitnessComposite(a, decomposition, n)) {
                return false;
            }
        }

        return true;
    }

    public PrimalityVerdict verdict(final long n) {
        return PrimalityVerdict.of(isPrime(n));
    }

    public PrimalityConfig getConfig() {
        return config;
    }
}
