package io.github.eutro.bil2ir.ir;

/**
 * Binary operations of the analysis IR, named after their p-code counterparts.
 */
public enum IrBinOpType {
    /**
     * Concatenation, the first operand forming the most significant bytes.
     */
    PIECE,
    INT_EQUAL,
    INT_NOTEQUAL,
    INT_LESS,
    INT_SLESS,
    INT_LESSEQUAL,
    INT_SLESSEQUAL,
    INT_ADD,
    INT_SUB,
    INT_CARRY,
    INT_SCARRY,
    INT_SBORROW,
    INT_XOR,
    INT_AND,
    INT_OR,
    INT_LEFT,
    INT_RIGHT,
    INT_SRIGHT,
    INT_MULT,
    INT_DIV,
    INT_REM,
    INT_SDIV,
    INT_SREM,
    BOOL_XOR,
    BOOL_AND,
    BOOL_OR,
    FLOAT_EQUAL,
    FLOAT_NOTEQUAL,
    FLOAT_LESS,
    FLOAT_LESSEQUAL,
    FLOAT_ADD,
    FLOAT_SUB,
    FLOAT_MULT,
    FLOAT_DIV,
}
