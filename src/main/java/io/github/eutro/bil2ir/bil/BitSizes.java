package io.github.eutro.bil2ir.bil;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bit-width inference for {@link Expression}s.
 * <p>
 * The width of an expression is always the sum of the widths of some of its
 * descendants ({@link Expression.Concat} sums both sides, every other variant
 * either has a fixed width or takes the width of one child), so it is computed
 * by walking just those descendants with a worklist.
 */
public class BitSizes {
    /**
     * Compute the width of the value an expression evaluates to.
     * <ul>
     *     <li>{@link Expression.Var}, {@link Expression.Unknown}: the width of the declared type.</li>
     *     <li>{@link Expression.Const}: the width of the constant.</li>
     *     <li>{@link Expression.Load}: {@code size}.</li>
     *     <li>{@link Expression.Store}: {@code 0}.</li>
     *     <li>{@link Expression.BinOp}: {@code 1} for comparisons, otherwise the width of {@code lhs}.</li>
     *     <li>{@link Expression.UnOp}: the width of {@code arg}.</li>
     *     <li>{@link Expression.Cast}: {@code width}.</li>
     *     <li>{@link Expression.IfThenElse}: the width of {@code trueExp}.</li>
     *     <li>{@link Expression.Extract}: {@code highBit - lowBit}.</li>
     *     <li>{@link Expression.Concat}: the sum of the widths of both sides.</li>
     * </ul>
     *
     * @param expr The expression.
     * @return The width, in bits.
     * @throws IllegalStateException If a {@link Expression.Let} is reached, or a variable or
     *                               unknown without a register type.
     */
    public static int bitSize(Expression expr) {
        int total = 0;
        Deque<Expression> work = new ArrayDeque<>();
        work.push(expr);
        while (!work.isEmpty()) {
            Expression next = work.pop();
            if (next instanceof Expression.Var) {
                total += ((Expression.Var) next).variable.bitSize();
            } else if (next instanceof Expression.Const) {
                total += ((Expression.Const) next).value.width();
            } else if (next instanceof Expression.Load) {
                total += ((Expression.Load) next).size;
            } else if (next instanceof Expression.Store) {
                // a store evaluates to memory, which has no width
            } else if (next instanceof Expression.BinOp) {
                Expression.BinOp binOp = (Expression.BinOp) next;
                if (binOp.op.isComparison()) {
                    total += 1;
                } else {
                    work.push(binOp.lhs);
                }
            } else if (next instanceof Expression.UnOp) {
                work.push(((Expression.UnOp) next).arg);
            } else if (next instanceof Expression.Cast) {
                total += ((Expression.Cast) next).width;
            } else if (next instanceof Expression.Let) {
                throw new IllegalStateException("bit size of let-binding is undefined: " + next);
            } else if (next instanceof Expression.Unknown) {
                total += ((Expression.Unknown) next).type.bitSize();
            } else if (next instanceof Expression.IfThenElse) {
                work.push(((Expression.IfThenElse) next).trueExp);
            } else if (next instanceof Expression.Extract) {
                Expression.Extract extract = (Expression.Extract) next;
                total += extract.highBit - extract.lowBit;
            } else if (next instanceof Expression.Concat) {
                Expression.Concat concat = (Expression.Concat) next;
                work.push(concat.left);
                work.push(concat.right);
            } else {
                throw new IllegalArgumentException("unknown expression: " + next.getClass());
            }
        }
        return total;
    }
}
