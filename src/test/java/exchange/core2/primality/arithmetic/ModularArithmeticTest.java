package exchange.core2.primality.arithmetic;

import org.junit.Test;

import java.math.BigInteger;
import java.util.Random;

import static exchange.core2.primality.arithmetic.ModularArithmetic.FLOOR_SQRT_MAX_LONG;
import static org.junit.Assert.assertEquals;

public class ModularArithmeticTest {

    private static final long[] MODULI = {
            1L,
            2L,
            7L,
            1_000_000_007L,
            FLOOR_SQRT_MAX_LONG,
            FLOOR_SQRT_MAX_LONG + 1,
            1L << 32,
            (1L << 32) + 15,
            4_611_686_018_427_387_847L,
            9_223_372_036_854_775_783L,
            Long.MAX_VALUE - 1,
            Long.MAX_VALUE
    };

    @Test
    public void mulModMatchesBigInteger() {

        final Random random = new Random(1L);

        for (long m : MODULI) {
            for (int i = 0; i < 10_000; i++) {
                final long a = Math.floorMod(random.nextLong(), m);
                final long b = Math.floorMod(random.nextLong(), m);
                assertEquals("a=" + a + " b=" + b + " m=" + m, referenceMulMod(a, b, m), ModularArithmetic.mulMod(a, b, m));
            }
        }
    }

    @Test
    public void mulModExtremeOperands() {

        for (long m : MODULI) {
            final long top = m - 1;
            assertEquals(referenceMulMod(top, top, m), ModularArithmetic.mulMod(top, top, m));
            assertEquals(referenceMulMod(top, 1, m), ModularArithmetic.mulMod(top, 1, m));
            assertEquals(0L, ModularArithmetic.mulMod(top, 0, m));
        }

        // (-1)^2 = 1
        assertEquals(1L, ModularArithmetic.mulMod(Long.MAX_VALUE - 1, Long.MAX_VALUE - 1, Long.MAX_VALUE));
    }

    @Test
    public void doubleAndAddAgreesWithSplitWord() {

        final Random random = new Random(2L);

        for (long m : MODULI) {
            for (int i = 0; i < 2_000; i++) {
                final long a = Math.floorMod(random.nextLong(), m);
                final long b = Math.floorMod(random.nextLong(), m);
                assertEquals(ModularArithmetic.mulMod(a, b, m), ModularArithmetic.mulModDoubleAndAdd(a, b, m));
            }
        }

        // unreduced operands are accepted
        assertEquals(referenceMulMod(100 % 7, 200 % 7, 7), ModularArithmetic.mulModDoubleAndAdd(100, 200, 7));
    }

    @Test
    public void powModMatchesBigInteger() {

        final Random random = new Random(3L);

        for (long m : MODULI) {
            for (int i = 0; i < 1_000; i++) {
                final long a = random.nextLong() & Long.MAX_VALUE;
                final long e = random.nextLong() & Long.MAX_VALUE;
                final long expected = BigInteger.valueOf(a).modPow(BigInteger.valueOf(e), BigInteger.valueOf(m)).longValueExact();
                assertEquals("a=" + a + " e=" + e + " m=" + m, expected, ModularArithmetic.powMod(a, e, m));
            }
        }
    }

    @Test
    public void powModZeroAndFirstPower() {

        final Random random = new Random(4L);

        for (long m : MODULI) {
            if (m == 1) {
                continue;
            }
            for (int i = 0; i < 100; i++) {
                final long a = random.nextLong() & Long.MAX_VALUE;
                assertEquals(1L, ModularArithmetic.powMod(a, 0, m));
                assertEquals(a % m, ModularArithmetic.powMod(a, 1, m));
            }
        }

        assertEquals(0L, ModularArithmetic.powMod(5, 0, 1));
        assertEquals(1L, ModularArithmetic.powMod(0, 0, 13));
        assertEquals(0L, ModularArithmetic.powMod(0, 5, 13));
    }

    @Test
    public void powModFermatLittleTheorem() {
        final long p = 9_223_372_036_854_775_783L;
        for (long a = 2; a < 100; a++) {
            assertEquals(1L, ModularArithmetic.powMod(a, p - 1, p));
        }
    }

    @Test
    public void times2ToThe32ModAcceptsUnsignedValues() {

        final BigInteger twoTo32 = BigInteger.ONE.shiftLeft(32);
        final long[] values = {0L, 1L, Long.MAX_VALUE, Long.MIN_VALUE, -1L, 0x8000_0000_0000_0001L};

        for (long m : MODULI) {
            for (long v : values) {
                final long expected = new BigInteger(Long.toUnsignedString(v)).multiply(twoTo32).mod(BigInteger.valueOf(m)).longValueExact();
                assertEquals(expected, ModularArithmetic.times2ToThe32Mod(v, m));
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void powModRejectsZeroModulus() {
        ModularArithmetic.powMod(2, 10, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void powModRejectsNegativeModulus() {
        ModularArithmetic.powMod(2, 10, -7);
    }

    @Test(expected = IllegalArgumentException.class)
    public void powModRejectsNegativeExponent() {
        ModularArithmetic.powMod(2, -1, 7);
    }

    @Test(expected = IllegalArgumentException.class)
    public void doubleAndAddRejectsNegativeOperand() {
        ModularArithmetic.mulModDoubleAndAdd(-2, 3, 7);
    }

    private static long referenceMulMod(long a, long b, long m) {
        return BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).mod(BigInteger.valueOf(m)).longValueExact();
    }
}
