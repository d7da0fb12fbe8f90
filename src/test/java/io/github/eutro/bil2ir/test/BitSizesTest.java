package io.github.eutro.bil2ir.test;

import io.github.eutro.bil2ir.bil.*;
import org.junit.jupiter.api.Test;

import static io.github.eutro.bil2ir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class BitSizesTest {
    @Test
    void testLeaves() {
        assertEquals(64, reg("RAX", 64).bitSize());
        assertEquals(8, cnst(234, 8).bitSize());
        assertEquals(16, new Expression.Unknown("flags", Type.immediate(16)).bitSize());
        assertEquals(32, new Expression.Load(mem("mem"), reg("RSP", 64), Endianness.BIG_ENDIAN, 32).bitSize());
        assertEquals(0, new Expression.Store(mem("mem"), reg("RSP", 64), reg("EAX", 32),
                Endianness.LITTLE_ENDIAN, 32).bitSize());
    }

    @Test
    void testExample() {
        assertEquals(8, bin(BinOpType.PLUS, cnst(234, 8), cnst(234, 8)).bitSize());
    }

    @Test
    void testBinOps() {
        for (BinOpType op : BinOpType.values()) {
            int expected = op.isComparison() ? 1 : 32;
            assertEquals(expected, bin(op, reg("EAX", 32), reg("EBX", 32)).bitSize(), op::name);
        }
        // shifts and everything else take the width of the left operand
        assertEquals(32, bin(BinOpType.LSHIFT, reg("EAX", 32), cnst(3, 8)).bitSize());
        assertEquals(1, bin(BinOpType.EQ, reg("RAX", 64), reg("RBX", 64)).bitSize());
    }

    @Test
    void testCompound() {
        assertEquals(32, new Expression.UnOp(UnOpType.NOT, reg("EAX", 32)).bitSize());
        for (CastType kind : CastType.values()) {
            assertEquals(16, new Expression.Cast(kind, 16, reg("EAX", 32)).bitSize(), kind::name);
        }
        assertEquals(64, new Expression.IfThenElse(
                bin(BinOpType.LT, reg("EAX", 32), reg("EBX", 32)),
                reg("RAX", 64),
                reg("RBX", 64)).bitSize());
        assertEquals(7, new Expression.Extract(4, 11, reg("RAX", 64)).bitSize());
        assertEquals(48, new Expression.Concat(reg("EAX", 32), reg("AX", 16)).bitSize());
        assertEquals(80, new Expression.Concat(
                new Expression.Concat(reg("EAX", 32), reg("AX", 16)),
                reg("EBX", 32)).bitSize());
    }

    @Test
    void testUndefined() {
        assertThrows(IllegalStateException.class,
                () -> let(Variable.register("x", 8), cnst(1, 8), reg("x", 8)).bitSize());
        assertThrows(IllegalStateException.class,
                () -> new Expression.UnOp(UnOpType.NEG, let(Variable.register("x", 8), cnst(1, 8), reg("x", 8))).bitSize());
        assertThrows(IllegalStateException.class, () -> mem("mem").bitSize());
        assertThrows(IllegalStateException.class,
                () -> new Expression.Unknown("?", Type.Unknown.INSTANCE).bitSize());
    }

    @Test
    void testDeepChain() {
        assertEquals(8 * 100_001, concatChain(100_000).bitSize());
        assertEquals(32, notChain(100_000).bitSize());
    }
}
