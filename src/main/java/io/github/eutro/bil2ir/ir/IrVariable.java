package io.github.eutro.bil2ir.ir;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public final class IrVariable {
    public final String name;
    public final ByteSize size;
    public final boolean isTemp;

    public IrVariable(String name, ByteSize size, boolean isTemp) {
        this.name = Objects.requireNonNull(name, "name");
        this.size = Objects.requireNonNull(size, "size");
        this.isTemp = isTemp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrVariable)) return false;
        IrVariable that = (IrVariable) o;
        return isTemp == that.isTemp && name.equals(that.name) && size.equals(that.size);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, size, isTemp);
    }

    @NotNull
    @Override
    public String toString() {
        return (isTemp ? "#" : "") + name + ":" + size;
    }
}
