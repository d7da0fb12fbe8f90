package io.github.eutro.bil2ir.bil;

import org.jetbrains.annotations.NotNull;

/**
 * The declared type of a {@link Variable} or {@link Expression.Unknown}.
 */
public abstract class Type {
    private Type() {
    }

    /**
     * Get the width of values of this type.
     *
     * @return The width, in bits.
     * @throws IllegalStateException If this is not a register (immediate) type.
     */
    public abstract int bitSize();

    /**
     * @return Whether {@link #bitSize()} is defined for this type.
     */
    public boolean hasBitSize() {
        return false;
    }

    public static Immediate immediate(int bitSize) {
        return new Immediate(bitSize);
    }

    public static Memory memory(int addrSize, int elemSize) {
        return new Memory(addrSize, elemSize);
    }

    /**
     * A register type: a fixed-width bitvector.
     */
    public static final class Immediate extends Type {
        public final int bitSize;

        public Immediate(int bitSize) {
            if (bitSize < 0) throw new IllegalArgumentException("negative bit size " + bitSize);
            this.bitSize = bitSize;
        }

        @Override
        public int bitSize() {
            return bitSize;
        }

        @Override
        public boolean hasBitSize() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Immediate && ((Immediate) o).bitSize == bitSize;
        }

        @Override
        public int hashCode() {
            return bitSize;
        }

        @NotNull
        @Override
        public String toString() {
            return "u" + bitSize;
        }
    }

    /**
     * A memory type, mapping addresses of {@code addrSize} bits to elements of {@code elemSize} bits.
     */
    public static final class Memory extends Type {
        public final int addrSize;
        public final int elemSize;

        public Memory(int addrSize, int elemSize) {
            this.addrSize = addrSize;
            this.elemSize = elemSize;
        }

        @Override
        public int bitSize() {
            throw new IllegalStateException("not a register type: " + this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Memory)) return false;
            Memory that = (Memory) o;
            return addrSize == that.addrSize && elemSize == that.elemSize;
        }

        @Override
        public int hashCode() {
            return 31 * addrSize + elemSize;
        }

        @NotNull
        @Override
        public String toString() {
            return "mem[u" + addrSize + " -> u" + elemSize + "]";
        }
    }

    /**
     * A type the lifter could not determine.
     */
    public static final class Unknown extends Type {
        public static final Unknown INSTANCE = new Unknown();

        private Unknown() {
        }

        @Override
        public int bitSize() {
            throw new IllegalStateException("not a register type: " + this);
        }

        @NotNull
        @Override
        public String toString() {
            return "unknown";
        }
    }
}
