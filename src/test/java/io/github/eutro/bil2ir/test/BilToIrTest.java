package io.github.eutro.bil2ir.test;

import io.github.eutro.bil2ir.bil.*;
import io.github.eutro.bil2ir.bits.Bitvector;
import io.github.eutro.bil2ir.ir.*;
import io.github.eutro.bil2ir.passes.convert.BilToIr;
import org.junit.jupiter.api.Test;

import static io.github.eutro.bil2ir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class BilToIrTest {
    private static IrExpression lower(Expression expr) {
        return BilToIr.INSTANCE.run(expr);
    }

    private static IrExpression.Var irReg(String name, int bytes) {
        return new IrExpression.Var(new IrVariable(name, ByteSize.of(bytes), false));
    }

    @Test
    void testLeaves() {
        assertEquals(irReg("RAX", 8), lower(reg("RAX", 64)));
        assertEquals(new IrExpression.Var(new IrVariable("t", ByteSize.of(4), true)), lower(temp("t", 32)));
        // flags and other sub-byte registers round up to a whole byte
        assertEquals(irReg("ZF", 1), lower(reg("ZF", 1)));
        assertEquals(new IrExpression.Const(Bitvector.fromU8(234)), lower(cnst(234, 8)));
    }

    @Test
    void testMemoryVariableHasNoSize() {
        IrExpression.Var lowered = (IrExpression.Var) lower(mem("mem"));
        assertEquals(ByteSize.ZERO, lowered.variable.size);
        assertEquals("mem", lowered.variable.name);
    }

    @Test
    void testOperatorTables() {
        for (BinOpType op : BinOpType.values()) {
            IrExpression lowered = lower(bin(op, reg("EAX", 32), reg("EBX", 32)));
            assertEquals(new IrExpression.BinOp(op.toIr(), irReg("EAX", 4), irReg("EBX", 4)), lowered, op::name);
        }
        assertEquals(IrBinOpType.INT_ADD, BinOpType.PLUS.toIr());
        assertEquals(IrBinOpType.INT_SRIGHT, BinOpType.ARSHIFT.toIr());
        assertEquals(IrBinOpType.INT_SLESSEQUAL, BinOpType.SLE.toIr());
        assertEquals(IrBinOpType.INT_REM, BinOpType.MOD.toIr());

        assertEquals(new IrExpression.UnOp(IrUnOpType.INT_2COMP, irReg("EAX", 4)),
                lower(new Expression.UnOp(UnOpType.NEG, reg("EAX", 32))));
        assertEquals(new IrExpression.UnOp(IrUnOpType.INT_NEGATE, irReg("EAX", 4)),
                lower(new Expression.UnOp(UnOpType.NOT, reg("EAX", 32))));
    }

    @Test
    void testCasts() {
        assertEquals(new IrExpression.Cast(IrCastOpType.INT_ZEXT, ByteSize.of(8), irReg("EAX", 4)),
                lower(new Expression.Cast(CastType.UNSIGNED, 64, reg("EAX", 32))));
        assertEquals(new IrExpression.Cast(IrCastOpType.INT_SEXT, ByteSize.of(8), irReg("EAX", 4)),
                lower(new Expression.Cast(CastType.SIGNED, 64, reg("EAX", 32))));
        // high 16 of 32 bits: skip the low 2 bytes, take 2
        assertEquals(new IrExpression.Subpiece(ByteSize.of(2), ByteSize.of(2), irReg("EAX", 4)),
                lower(new Expression.Cast(CastType.HIGH, 16, reg("EAX", 32))));
        assertEquals(new IrExpression.Subpiece(ByteSize.ZERO, ByteSize.of(2), irReg("EAX", 4)),
                lower(new Expression.Cast(CastType.LOW, 16, reg("EAX", 32))));
        // low casts to sub-byte widths round up
        assertEquals(new IrExpression.Subpiece(ByteSize.ZERO, ByteSize.of(1), irReg("EAX", 4)),
                lower(new Expression.Cast(CastType.LOW, 1, reg("EAX", 32))));
    }

    @Test
    void testUnalignedHighCast() {
        assertThrows(IllegalArgumentException.class,
                () -> lower(new Expression.Cast(CastType.HIGH, 12, reg("EAX", 32))));
    }

    @Test
    void testExtractAndConcat() {
        assertEquals(new IrExpression.Subpiece(ByteSize.of(1), ByteSize.of(1), irReg("EAX", 4)),
                lower(new Expression.Extract(8, 15, reg("EAX", 32))));
        assertEquals(new IrExpression.Subpiece(ByteSize.ZERO, ByteSize.of(4), irReg("RAX", 8)),
                lower(new Expression.Extract(0, 31, reg("RAX", 64))));
        assertEquals(new IrExpression.BinOp(IrBinOpType.PIECE, irReg("EAX", 4), irReg("AX", 2)),
                lower(new Expression.Concat(reg("EAX", 32), reg("AX", 16))));
    }

    @Test
    void testNested() {
        // (zext:64(EAX) + 1) == RBX
        Expression input = bin(BinOpType.EQ,
                bin(BinOpType.PLUS, new Expression.Cast(CastType.UNSIGNED, 64, reg("EAX", 32)), cnst(1, 64)),
                reg("RBX", 64));
        IrExpression expected = new IrExpression.BinOp(IrBinOpType.INT_EQUAL,
                new IrExpression.BinOp(IrBinOpType.INT_ADD,
                        new IrExpression.Cast(IrCastOpType.INT_ZEXT, ByteSize.of(8), irReg("EAX", 4)),
                        new IrExpression.Const(Bitvector.fromU64(1))),
                irReg("RBX", 8));
        assertEquals(expected, lower(input));
    }

    @Test
    void testUnsupported() {
        Expression load = new Expression.Load(mem("m"), cnst(0, 64), Endianness.LITTLE_ENDIAN, 32);
        assertThrows(UnsupportedOperationException.class, () -> lower(load));
        assertThrows(UnsupportedOperationException.class, () -> lower(
                new Expression.Store(mem("m"), cnst(0, 64), reg("EAX", 32), Endianness.BIG_ENDIAN, 32)));
        assertThrows(UnsupportedOperationException.class, () -> lower(
                let(Variable.register("x", 8), cnst(1, 8), reg("x", 8))));
        assertThrows(UnsupportedOperationException.class, () -> lower(
                new Expression.Unknown("cpuid", Type.immediate(32))));
        assertThrows(UnsupportedOperationException.class, () -> lower(
                new Expression.IfThenElse(reg("ZF", 1), reg("EAX", 32), reg("EBX", 32))));
    }

    @Test
    void testUnsupportedDeepInside() {
        Expression input = bin(BinOpType.PLUS,
                reg("EAX", 32),
                new Expression.UnOp(UnOpType.NOT,
                        new Expression.Load(mem("m"), cnst(0, 64), Endianness.LITTLE_ENDIAN, 32)));
        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class, () -> lower(input));
        assertTrue(e.getMessage().contains("memory access"), e::getMessage);
    }

    @Test
    void testDeepChain() {
        IrExpression lowered = lower(concatChain(100_000));
        int depth = 0;
        while (lowered instanceof IrExpression.BinOp) {
            assertEquals(IrBinOpType.PIECE, ((IrExpression.BinOp) lowered).op);
            lowered = ((IrExpression.BinOp) lowered).lhs;
            depth++;
        }
        assertEquals(100_000, depth);
        assertEquals(new IrExpression.Const(Bitvector.fromU8(0)), lowered);
    }
}
