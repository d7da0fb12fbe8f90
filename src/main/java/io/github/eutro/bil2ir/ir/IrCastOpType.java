package io.github.eutro.bil2ir.ir;

public enum IrCastOpType {
    INT_ZEXT,
    INT_SEXT,
    INT2FLOAT,
    FLOAT2FLOAT,
    TRUNC,
    POPCOUNT,
}
