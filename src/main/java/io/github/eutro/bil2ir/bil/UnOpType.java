package io.github.eutro.bil2ir.bil;

import io.github.eutro.bil2ir.ir.IrUnOpType;

public enum UnOpType {
    /**
     * Two's complement negation.
     */
    NEG(IrUnOpType.INT_2COMP),
    /**
     * Bitwise complement.
     */
    NOT(IrUnOpType.INT_NEGATE),
    ;

    private final IrUnOpType irOp;

    UnOpType(IrUnOpType irOp) {
        this.irOp = irOp;
    }

    public IrUnOpType toIr() {
        return irOp;
    }
}
