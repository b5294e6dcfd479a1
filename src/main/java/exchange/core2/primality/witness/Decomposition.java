package exchange.core2.primality.witness;

/**
 * Odd part and power of two of {@code n - 1}: {@code n - 1 = d * 2^s}, d odd, s >= 1.
 */
public final class Decomposition {

    private final int s;
    private final long d;

    private Decomposition(final int s, final long d) {
        this.s = s;
        this.d = d;
    }

    /**
     * @param n odd candidate, n >= 3
     * @throws IllegalArgumentException if n is even or below 3
     */
    public static Decomposition of(final long n) {

        if (n < 3 || (n & 1L) == 0) {
            throw new IllegalArgumentException("Decomposition requires an odd candidate >= 3, got " + n);
        }

        long d = n - 1;
        int s = 0;
        while ((d & 1L) == 0) {
            d >>= 1;
            s++;
        }

        return new Decomposition(s, d);
    }

    public int getS() {
        return s;
    }

    public long getD() {
        return d;
    }

    @Override
    public String toString() {
        return "Decomposition{" +
                "s=" + s +
                ", d=" + d +
                '}';
    }
}
