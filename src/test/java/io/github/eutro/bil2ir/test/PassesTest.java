package io.github.eutro.bil2ir.test;

import io.github.eutro.bil2ir.bil.*;
import io.github.eutro.bil2ir.bits.Bitvector;
import io.github.eutro.bil2ir.conf.LoweringConventions;
import io.github.eutro.bil2ir.ir.*;
import io.github.eutro.bil2ir.passes.IRPass;
import io.github.eutro.bil2ir.passes.Passes;
import io.github.eutro.bil2ir.passes.misc.ChainedPass;
import org.junit.jupiter.api.Test;

import static io.github.eutro.bil2ir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    private static final Variable X = new Variable("x", Type.immediate(64), true);

    // let x = RAX in x + 42
    private static Expression example() {
        return let(X, reg("RAX", 64), bin(BinOpType.PLUS, new Expression.Var(X), cnst(42, 64)));
    }

    private static final IrExpression EXAMPLE_LOWERED = new IrExpression.BinOp(IrBinOpType.INT_ADD,
            new IrExpression.Var(new IrVariable("RAX", ByteSize.of(8), false)),
            new IrExpression.Const(Bitvector.fromU64(42)));

    @Test
    void testLower() {
        assertEquals(EXAMPLE_LOWERED, Passes.LOWER.run(example()));
        assertEquals(EXAMPLE_LOWERED, Passes.CHECKED_LOWER.run(example()));
        assertEquals(EXAMPLE_LOWERED, LoweringConventions.DEFAULT.run(example()));
    }

    @Test
    void testChainShape() {
        assertEquals("replace-let-bindings -> verify-bit-sizes -> bil-to-ir", Passes.CHECKED_LOWER.toString());
        assertEquals(3, ((ChainedPass<?, ?, ?>) Passes.CHECKED_LOWER).getPasses().size());
        assertFalse(Passes.LOWER.isInPlace());
    }

    @Test
    void testConventions() {
        IRPass<Expression, IrExpression> bare = LoweringConventions.createBuilder()
                .setReplaceLetBindings(false)
                .build();
        assertEquals("bil-to-ir", bare.toString());
        assertThrows(UnsupportedOperationException.class, () -> bare.run(example()));

        IRPass<Expression, IrExpression> checked = LoweringConventions.createBuilder()
                .setVerifyBitSizes(true)
                .build();
        assertEquals(Passes.CHECKED_LOWER.toString(), checked.toString());
        assertEquals(EXAMPLE_LOWERED, checked.run(example()));
    }

    @Test
    void testFailureNamesStage() {
        Expression mismatched = let(X, reg("EAX", 32), bin(BinOpType.PLUS, new Expression.Var(X), cnst(1, 64)));
        // the let binds a 64-bit name to a 32-bit value, which only verification notices
        assertDoesNotThrow(() -> Passes.LOWER.run(mismatched.copy()));
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> Passes.CHECKED_LOWER.run(mismatched));
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().contains("verify-bit-sizes"), e.getSuppressed()[0]::getMessage);
    }

    @Test
    void testLoadIsFatal() {
        Expression load = new Expression.Load(mem("m"), cnst(0, 64), Endianness.LITTLE_ENDIAN, 32);
        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> Passes.LOWER.run(load));
        assertTrue(e.getSuppressed()[0].getMessage().contains("bil-to-ir"));
    }
}
