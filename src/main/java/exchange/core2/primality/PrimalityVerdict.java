package exchange.core2.primality;

public enum PrimalityVerdict {
    PRIME,
    COMPOSITE;

    public static PrimalityVerdict of(boolean prime) {
        return prime ? PRIME : COMPOSITE;
    }

    public boolean isPrime() {
        return this == PRIME;
    }
}
