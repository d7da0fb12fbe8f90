package io.github.eutro.bil2ir.test;

import io.github.eutro.bil2ir.bil.*;
import io.github.eutro.bil2ir.bits.Bitvector;

public class Utils {
    public static Expression.Var reg(String name, int bits) {
        return new Expression.Var(Variable.register(name, bits));
    }

    public static Expression.Var temp(String name, int bits) {
        return new Expression.Var(new Variable(name, Type.immediate(bits), true));
    }

    public static Expression.Var mem(String name) {
        return new Expression.Var(new Variable(name, Type.memory(64, 8), false));
    }

    public static Expression.Const cnst(long value, int bits) {
        return new Expression.Const(Bitvector.fromLong(value, bits));
    }

    public static Expression.BinOp bin(BinOpType op, Expression lhs, Expression rhs) {
        return new Expression.BinOp(op, lhs, rhs);
    }

    public static Expression.Let let(Variable var, Expression bound, Expression body) {
        return new Expression.Let(var, bound, body);
    }

    /**
     * A left-leaning chain of {@code depth} concatenations of 8-bit constants.
     */
    public static Expression concatChain(int depth) {
        Expression acc = cnst(0, 8);
        for (int i = 0; i < depth; i++) {
            acc = new Expression.Concat(acc, cnst(i & 0xFF, 8));
        }
        return acc;
    }

    /**
     * A chain of {@code depth} bitwise negations of a 32-bit register.
     */
    public static Expression notChain(int depth) {
        Expression acc = reg("EAX", 32);
        for (int i = 0; i < depth; i++) {
            acc = new Expression.UnOp(UnOpType.NOT, acc);
        }
        return acc;
    }
}
