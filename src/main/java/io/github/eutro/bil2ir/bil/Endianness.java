package io.github.eutro.bil2ir.bil;

import org.jetbrains.annotations.Nullable;

public enum Endianness {
    LITTLE_ENDIAN("LittleEndian"),
    BIG_ENDIAN("BigEndian"),
    ;

    private final String serialName;

    Endianness(String serialName) {
        this.serialName = serialName;
    }

    /**
     * @return The name of this in the lifter's interchange format.
     */
    public String serialName() {
        return serialName;
    }

    @Nullable
    public static Endianness bySerialName(String name) {
        for (Endianness endianness : values()) {
            if (endianness.serialName.equals(name)) return endianness;
        }
        return null;
    }

    @Override
    public String toString() {
        return serialName;
    }
}
