package exchange.core2.primality.benchmark;

import exchange.core2.primality.PrimalityTester;
import net.openhft.affinity.AffinityLock;
import org.HdrHistogram.Histogram;
import org.HdrHistogram.SingleWriterRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Measures isPrime latency for consecutive odd candidates just below Long.MAX_VALUE,
 * the range where every call takes the split-word multiplication path.
 */
public final class PrimalityBenchmark {

    private static final Logger log = LoggerFactory.getLogger(PrimalityBenchmark.class);

    private static final SingleWriterRecorder hdrRecorder = new SingleWriterRecorder(Integer.MAX_VALUE, 2);

    private final PrimalityTester tester;
    private final int iterationsPerCycle;
    private final int warmupIterations;

    public PrimalityBenchmark(PrimalityTester tester, int iterationsPerCycle, int warmupIterations) {
        this.tester = tester;
        this.iterationsPerCycle = iterationsPerCycle;
        this.warmupIterations = warmupIterations;
    }

    public static void main(String[] args) {

        final int cycles = args.length > 0 ? Integer.parseInt(args[0]) : 20;

        final PrimalityBenchmark benchmark = new PrimalityBenchmark(PrimalityTester.createDefault(), 1_000_000, 40_000);

        try (final AffinityLock lock = AffinityLock.acquireCore()) {
            log.info("Running {} cycles on cpu {}", cycles, lock.cpuId());
            for (int i = 0; i < cycles; i++) {
                benchmark.runCycle();
            }
        }
    }

    /**
     * @return number of primes found, so the loop can not be eliminated
     */
    public int runCycle() {

        hdrRecorder.reset();

        final long firstCandidate = Long.MAX_VALUE - 2L * iterationsPerCycle;

        int primes = 0;
        long totalDurationNs = 0L;

        for (int i = 0; i < iterationsPerCycle; i++) {

            final long candidate = firstCandidate + 2L * i;

            final long startTime = System.nanoTime();
            if (tester.isPrime(candidate)) {
                primes++;
            }
            final long durationNs = System.nanoTime() - startTime;

            if (i >= warmupIterations) {
                hdrRecorder.recordValue(durationNs);
                totalDurationNs += durationNs;
            }
        }

        final Histogram histogram = hdrRecorder.getIntervalHistogram();
        final Map<String, String> report = LatencyReport.create(histogram);
        final long measured = Math.max(1, iterationsPerCycle - warmupIterations);

        log.info("average: {} ns, {}, primes={}", totalDurationNs / measured, report, primes);

        return primes;
    }
}
