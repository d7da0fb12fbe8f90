package io.github.eutro.bil2ir.bil;

import io.github.eutro.bil2ir.ir.IrBinOpType;

/**
 * Binary operators of the lifted expression language.
 * <p>
 * Each operator names the analysis IR operator it lowers to, so the table cannot have gaps.
 */
public enum BinOpType {
    PLUS(IrBinOpType.INT_ADD),
    MINUS(IrBinOpType.INT_SUB),
    TIMES(IrBinOpType.INT_MULT),
    DIVIDE(IrBinOpType.INT_DIV),
    SDIVIDE(IrBinOpType.INT_SDIV),
    MOD(IrBinOpType.INT_REM),
    SMOD(IrBinOpType.INT_SREM),
    LSHIFT(IrBinOpType.INT_LEFT),
    RSHIFT(IrBinOpType.INT_RIGHT),
    ARSHIFT(IrBinOpType.INT_SRIGHT),
    AND(IrBinOpType.INT_AND),
    OR(IrBinOpType.INT_OR),
    XOR(IrBinOpType.INT_XOR),
    EQ(IrBinOpType.INT_EQUAL),
    NEQ(IrBinOpType.INT_NOTEQUAL),
    LT(IrBinOpType.INT_LESS),
    LE(IrBinOpType.INT_LESSEQUAL),
    SLT(IrBinOpType.INT_SLESS),
    SLE(IrBinOpType.INT_SLESSEQUAL),
    ;

    private final IrBinOpType irOp;

    BinOpType(IrBinOpType irOp) {
        this.irOp = irOp;
    }

    public IrBinOpType toIr() {
        return irOp;
    }

    /**
     * @return Whether this operator yields a single-bit truth value.
     */
    public boolean isComparison() {
        switch (this) {
            case EQ:
            case NEQ:
            case LT:
            case LE:
            case SLT:
            case SLE:
                return true;
            default:
                return false;
        }
    }

    /**
     * @return Whether the operands of this operator may differ in width.
     */
    public boolean isShift() {
        return this == LSHIFT || this == RSHIFT || this == ARSHIFT;
    }
}
