package io.github.eutro.bil2ir.ir;

import org.jetbrains.annotations.NotNull;

/**
 * A non-negative size, in bytes.
 */
public final class ByteSize implements Comparable<ByteSize> {
    public static final ByteSize ZERO = new ByteSize(0);

    private final long bytes;

    private ByteSize(long bytes) {
        this.bytes = bytes;
    }

    public static ByteSize of(long bytes) {
        if (bytes < 0) throw new IllegalArgumentException("negative byte size " + bytes);
        return bytes == 0 ? ZERO : new ByteSize(bytes);
    }

    /**
     * Convert a width in bits to bytes, rounding up to the nearest whole byte.
     *
     * @param bits The width, in bits.
     * @return The size.
     */
    public static ByteSize fromBits(long bits) {
        if (bits < 0) throw new IllegalArgumentException("negative bit size " + bits);
        return of((bits + 7) / 8);
    }

    public long bytes() {
        return bytes;
    }

    public long asBits() {
        return bytes * 8;
    }

    @Override
    public int compareTo(@NotNull ByteSize o) {
        return Long.compare(bytes, o.bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ByteSize && ((ByteSize) o).bytes == bytes;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bytes);
    }

    @NotNull
    @Override
    public String toString() {
        return Long.toString(bytes);
    }
}
