package exchange.core2.primality.benchmark;

import org.HdrHistogram.Histogram;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Percentile summary of a latency histogram recorded in nanoseconds.
 */
public final class LatencyReport {

    private static final double[] PERCENTILES = {50, 90, 95, 99, 99.9, 99.99};

    private static final String[] UNITS = {"ns", "µs", "ms", "s"};

    private LatencyReport() {
    }

    /**
     * Percentile label ("99.9%") to formatted latency, plus "W" for the worst value.
     */
    public static Map<String, String> create(final Histogram histogram) {
        final Map<String, String> report = new LinkedHashMap<>();
        for (double percentile : PERCENTILES) {
            report.put(percentile + "%", formatNanos(histogram.getValueAtPercentile(percentile)));
        }
        report.put("W", formatNanos(histogram.getMaxValue()));
        return report;
    }

    public static String formatNanos(final long nanos) {

        double value = nanos;
        int unit = 0;
        while (value > 1000 && unit < UNITS.length - 1) {
            value /= 1000;
            unit++;
        }

        // three significant digits at most
        final double scale;
        if (value < 3) {
            scale = 100;
        } else if (value < 30) {
            scale = 10;
        } else {
            scale = 1;
        }

        final double rounded = Math.round(value * scale) / scale;
        return (rounded == Math.rint(rounded) ? String.valueOf((long) rounded) : String.valueOf(rounded)) + UNITS[unit];
    }
}
