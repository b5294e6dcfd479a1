package exchange.core2.primality;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Base sets used by {@link PrimalityTester}.
 * <p>
 * Candidates below {@code extendedThreshold} are tested against {@code primaryBases},
 * the others against {@code extendedBases}. Bases not smaller than the candidate are skipped.
 */
public final class PrimalityConfig {

    public static final long[] DEFAULT_PRIMARY_BASES = {2, 3, 5, 7, 11, 13, 17};

    public static final long[] DEFAULT_EXTENDED_BASES = {2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37};

    // smallest strong pseudoprime to every base in 2..17
    public static final long DEFAULT_EXTENDED_THRESHOLD = 341_550_071_728_321L;

    public static final PrimalityConfig DEFAULT = builder().build();

    private final long[] primaryBases;
    private final long[] extendedBases;
    private final long extendedThreshold;

    private PrimalityConfig(final long[] primaryBases,
                            final long[] extendedBases,
                            final long extendedThreshold) {

        this.primaryBases = primaryBases;
        this.extendedBases = extendedBases;
        this.extendedThreshold = extendedThreshold;
    }

    /**
     * Single base list applied to every candidate.
     */
    public static PrimalityConfig ofBases(final long... bases) {
        return builder()
                .primaryBases(bases)
                .extendedBases(bases)
                .extendedThreshold(Long.MAX_VALUE)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Bases applicable to the candidate before skipping the ones >= n.
     */
    long[] basesFor(final long n) {
        return n >= extendedThreshold ? extendedBases : primaryBases;
    }

    public long[] getPrimaryBases() {
        return primaryBases.clone();
    }

    public long[] getExtendedBases() {
        return extendedBases.clone();
    }

    public long getExtendedThreshold() {
        return extendedThreshold;
    }

    @Override
    public String toString() {
        return "PrimalityConfig{" +
                "primaryBases=" + Arrays.toString(primaryBases) +
                ", extendedBases=" + Arrays.toString(extendedBases) +
                ", extendedThreshold=" + extendedThreshold +
                '}';
    }

    public static final class Builder {

        private long[] primaryBases = DEFAULT_PRIMARY_BASES;
        private long[] extendedBases = DEFAULT_EXTENDED_BASES;
        private long extendedThreshold = DEFAULT_EXTENDED_THRESHOLD;

        private Builder() {
        }

        public Builder primaryBases(@NotNull final long... primaryBases) {
            this.primaryBases = primaryBases;
            return this;
        }

        public Builder extendedBases(@NotNull final long... extendedBases) {
            this.extendedBases = extendedBases;
            return this;
        }

        public Builder extendedThreshold(final long extendedThreshold) {
            this.extendedThreshold = extendedThreshold;
            return this;
        }

        public PrimalityConfig build() {

            if (extendedThreshold < 2) {
                throw new IllegalArgumentException("Extended bases threshold must be >= 2, got " + extendedThreshold);
            }

            return new PrimalityConfig(
                    validateBases("primary", primaryBases),
                    validateBases("extended", extendedBases),
                    extendedThreshold);
        }

        private static long[] validateBases(final String name, final long[] bases) {

            if (bases == null || bases.length == 0) {
                throw new IllegalArgumentException("At least one " + name + " base required");
            }

            for (long base : bases) {
                if (base < 2) {
                    throw new IllegalArgumentException("Invalid " + name + " base " + base + ": must be >= 2");
                }
            }

            return bases.clone();
        }
    }
}
