package io.github.eutro.bil2ir.bits;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;

/**
 * An immutable integer of an exact, arbitrary bit width.
 * <p>
 * The value is stored as the unsigned bit pattern, always reduced modulo {@code 2^width}.
 */
public final class Bitvector {
    private static final BigInteger U64_MASK = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final int width;
    private final BigInteger value;

    private Bitvector(int width, BigInteger value) {
        this.width = width;
        this.value = value;
    }

    /**
     * Create a bitvector from the low {@code width} bits of a (possibly negative) integer,
     * interpreted in two's complement.
     *
     * @param value The integer.
     * @param width The width, in bits.
     * @return The bitvector.
     */
    @Contract(pure = true)
    public static Bitvector of(BigInteger value, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("bitvector width must be positive, got " + width);
        }
        BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
        return new Bitvector(width, value.and(mask));
    }

    @Contract(pure = true)
    public static Bitvector fromLong(long value, int width) {
        return of(BigInteger.valueOf(value), width);
    }

    public static Bitvector fromU8(int value) {
        return fromLong(value, 8);
    }

    public static Bitvector fromU16(int value) {
        return fromLong(value, 16);
    }

    public static Bitvector fromU32(long value) {
        return fromLong(value, 32);
    }

    public static Bitvector fromU64(long value) {
        return fromLong(value, 64);
    }

    /**
     * Assemble a bitvector from little-endian 64-bit digits.
     * <p>
     * Each digit is read as unsigned. Bits beyond {@code width} are discarded.
     *
     * @param digits The digits, least significant first.
     * @param width  The width, in bits.
     * @return The bitvector.
     */
    @Contract(pure = true)
    public static Bitvector fromDigits(long[] digits, int width) {
        BigInteger acc = BigInteger.ZERO;
        for (int i = digits.length - 1; i >= 0; i--) {
            acc = acc.shiftLeft(64).or(BigInteger.valueOf(digits[i]).and(U64_MASK));
        }
        return of(acc, width);
    }

    /**
     * Split the value into little-endian 64-bit digits.
     *
     * @return Exactly {@code ceil(width / 64)} digits, least significant first.
     */
    public long[] digits() {
        long[] digits = new long[(width + 63) / 64];
        BigInteger rest = value;
        for (int i = 0; i < digits.length; i++) {
            digits[i] = rest.longValue();
            rest = rest.shiftRight(64);
        }
        return digits;
    }

    public int width() {
        return width;
    }

    /**
     * @return The value, as an unsigned integer.
     */
    public BigInteger unsignedValue() {
        return value;
    }

    /**
     * @return The value, interpreted as a two's complement signed integer.
     */
    public BigInteger signedValue() {
        return value.testBit(width - 1) ? value.subtract(BigInteger.ONE.shiftLeft(width)) : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Bitvector that = (Bitvector) o;
        return width == that.width && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * width + value.hashCode();
    }

    @NotNull
    @Override
    public String toString() {
        return "0x" + value.toString(16) + ":" + width;
    }
}
