package io.github.eutro.bil2ir.bil;

public enum CastType {
    /**
     * Zero-extend (or truncate) to the target width.
     */
    UNSIGNED,
    /**
     * Sign-extend (or truncate) to the target width.
     */
    SIGNED,
    /**
     * Keep the most significant bits.
     */
    HIGH,
    /**
     * Keep the least significant bits.
     */
    LOW,
}
