package io.github.eutro.bil2ir.test;

import io.github.eutro.bil2ir.bil.*;
import io.github.eutro.bil2ir.passes.form.ReplaceLetBindings;
import io.github.eutro.bil2ir.util.TreeWalker;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import static io.github.eutro.bil2ir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ReplaceLetBindingsTest {
    private static final Variable X = new Variable("x", Type.immediate(64), true);
    private static final Variable Y = new Variable("y", Type.immediate(64), true);

    private static Expression run(Expression expr) {
        return ReplaceLetBindings.INSTANCE.run(expr);
    }

    private static void assertLetFree(Expression expr) {
        for (Expression node : TreeWalker.of(expr).preOrder()) {
            assertFalse(node instanceof Expression.Let, () -> "let left in " + expr);
        }
    }

    @Test
    void testConstantBinding() {
        // let x = 12 in x + 42
        Expression input = let(X, cnst(12, 64),
                bin(BinOpType.PLUS, new Expression.Var(X), cnst(42, 64)));
        assertEquals(bin(BinOpType.PLUS, cnst(12, 64), cnst(42, 64)), run(input));
    }

    @Test
    void testSimple() {
        // let x = RAX in x + 42
        Expression input = let(X, reg("RAX", 64),
                bin(BinOpType.PLUS, new Expression.Var(X), cnst(42, 64)));
        Expression expected = bin(BinOpType.PLUS, reg("RAX", 64), cnst(42, 64));
        assertEquals(expected, run(input));
    }

    @Test
    void testEveryUseGetsItsOwnCopy() {
        Expression input = let(X, bin(BinOpType.TIMES, reg("RAX", 64), cnst(3, 64)),
                bin(BinOpType.PLUS, new Expression.Var(X), new Expression.Var(X)));
        Expression.BinOp output = (Expression.BinOp) run(input);
        assertEquals(output.lhs, output.rhs);
        assertNotSame(output.lhs, output.rhs);

        Set<Expression> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Expression node : TreeWalker.of(output).preOrder()) {
            assertTrue(seen.add(node), () -> "node reachable twice: " + node);
        }
    }

    @Test
    void testUnusedBinding() {
        assertEquals(cnst(7, 8), run(let(X, reg("RAX", 64), cnst(7, 8))));
    }

    @Test
    void testFreeVariablesKept() {
        Expression input = let(X, cnst(1, 64), bin(BinOpType.MINUS, new Expression.Var(Y), new Expression.Var(X)));
        assertEquals(bin(BinOpType.MINUS, new Expression.Var(Y), cnst(1, 64)), run(input));

        Expression noLets = bin(BinOpType.AND, reg("RAX", 64), new Expression.Var(X));
        Expression output = run(noLets);
        assertEquals(noLets, output);
        assertNotSame(noLets, output);
    }

    @Test
    void testOtherVariableWithSameName() {
        // only an equal variable is bound, not one that merely shares the name
        Expression input = let(X, cnst(1, 64),
                bin(BinOpType.PLUS, new Expression.Var(X), reg("x", 64)));
        assertEquals(bin(BinOpType.PLUS, cnst(1, 64), reg("x", 64)), run(input));
    }

    @Test
    void testNestedBindings() {
        // let x = RAX in let y = x + 1 in y * x
        Expression input = let(X, reg("RAX", 64),
                let(Y, bin(BinOpType.PLUS, new Expression.Var(X), cnst(1, 64)),
                        bin(BinOpType.TIMES, new Expression.Var(Y), new Expression.Var(X))));
        Expression expected = bin(BinOpType.TIMES,
                bin(BinOpType.PLUS, reg("RAX", 64), cnst(1, 64)),
                reg("RAX", 64));
        Expression output = run(input);
        assertEquals(expected, output);
        assertLetFree(output);
    }

    @Test
    void testLetInsideBoundExpression() {
        // let x = (let y = RBX in y ^ y) in x
        Expression input = let(X,
                let(Y, reg("RBX", 64), bin(BinOpType.XOR, new Expression.Var(Y), new Expression.Var(Y))),
                new Expression.Var(X));
        Expression output = run(input);
        assertEquals(bin(BinOpType.XOR, reg("RBX", 64), reg("RBX", 64)), output);
        assertLetFree(output);
    }

    @Test
    void testShadowing() {
        // let x = 1 in (let x = 2 in x) + x
        Expression input = let(X, cnst(1, 64),
                bin(BinOpType.PLUS,
                        let(X, cnst(2, 64), new Expression.Var(X)),
                        new Expression.Var(X)));
        assertEquals(bin(BinOpType.PLUS, cnst(2, 64), cnst(1, 64)), run(input));
    }

    @Test
    void testShadowingRefersToOuterInBoundExpression() {
        // let x = 1 in let x = x + x in x
        Expression input = let(X, cnst(1, 64),
                let(X, bin(BinOpType.PLUS, new Expression.Var(X), new Expression.Var(X)),
                        new Expression.Var(X)));
        assertEquals(bin(BinOpType.PLUS, cnst(1, 64), cnst(1, 64)), run(input));
    }

    @Test
    void testInputUnchanged() {
        Expression input = let(X, reg("RAX", 64), bin(BinOpType.PLUS, new Expression.Var(X), cnst(42, 64)));
        Expression before = input.copy();
        run(input);
        assertEquals(before, input);
    }

    @Test
    void testIdempotent() {
        Expression input = let(X, reg("RAX", 64),
                new Expression.IfThenElse(
                        bin(BinOpType.EQ, new Expression.Var(X), cnst(0, 64)),
                        let(Y, cnst(5, 64), new Expression.Var(Y)),
                        new Expression.Var(X)));
        Expression once = run(input);
        assertLetFree(once);
        assertEquals(once, run(once));
    }

    @Test
    void testChainedBindings() {
        // every binding copies the previous one, so this is quadratic in the chain length
        Expression body = new Expression.Var(X);
        for (int i = 0; i < 2_000; i++) {
            body = let(X, new Expression.UnOp(UnOpType.NOT, new Expression.Var(X)), body);
        }
        Expression input = let(X, reg("RAX", 64), body);
        Expression output = run(input);
        int depth = 0;
        while (output instanceof Expression.UnOp) {
            output = ((Expression.UnOp) output).arg;
            depth++;
        }
        assertEquals(reg("RAX", 64), output);
        assertEquals(2_000, depth);
    }
}
