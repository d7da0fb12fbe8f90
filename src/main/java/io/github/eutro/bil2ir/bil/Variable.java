package io.github.eutro.bil2ir.bil;

import io.github.eutro.bil2ir.ir.ByteSize;
import io.github.eutro.bil2ir.ir.IrVariable;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A named register or memory operand.
 * <p>
 * Variables are values: two variables are the same variable iff their
 * name, type and temporary flag are all equal.
 */
public final class Variable {
    public final String name;
    public final Type type;
    public final boolean isTemp;

    public Variable(String name, Type type, boolean isTemp) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.isTemp = isTemp;
    }

    /**
     * Create a non-temporary register of the given width.
     *
     * @param name    The register name.
     * @param bitSize The width, in bits.
     * @return The variable.
     */
    public static Variable register(String name, int bitSize) {
        return new Variable(name, Type.immediate(bitSize), false);
    }

    /**
     * @return The width of this variable.
     * @throws IllegalStateException If the type of this variable has no width.
     * @see Type#bitSize()
     */
    public int bitSize() {
        return type.bitSize();
    }

    /**
     * Convert this to a variable of the analysis IR.
     * <p>
     * Register widths are rounded up to whole bytes. Variables without a register
     * type have a size of zero bytes.
     *
     * @return The IR variable.
     */
    public IrVariable toIr() {
        ByteSize size = type.hasBitSize() ? ByteSize.fromBits(type.bitSize()) : ByteSize.ZERO;
        return new IrVariable(name, size, isTemp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable that = (Variable) o;
        return isTemp == that.isTemp && name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, isTemp);
    }

    @NotNull
    @Override
    public String toString() {
        return (isTemp ? "#" : "") + name + ":" + type;
    }
}
