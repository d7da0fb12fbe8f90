package io.github.eutro.bil2ir.ir;

/**
 * Unary operations of the analysis IR, named after their p-code counterparts.
 */
public enum IrUnOpType {
    /**
     * Bitwise complement.
     */
    INT_NEGATE,
    /**
     * Two's complement negation.
     */
    INT_2COMP,
    BOOL_NEGATE,
    FLOAT_NEGATE,
    FLOAT_ABS,
    FLOAT_SQRT,
    FLOAT_CEIL,
    FLOAT_FLOOR,
    FLOAT_ROUND,
    FLOAT_NAN,
}
