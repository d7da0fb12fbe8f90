package io.github.eutro.bil2ir.passes.meta;

import io.github.eutro.bil2ir.bil.CastType;
import io.github.eutro.bil2ir.bil.Expression;
import io.github.eutro.bil2ir.bil.Type;
import io.github.eutro.bil2ir.passes.InPlaceIRPass;
import io.github.eutro.bil2ir.util.Trees;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A pass which checks that the widths in a let-free expression are consistent,
 * throwing {@link IllegalStateException} at the first node where they are not.
 * <p>
 * Widths are computed bottom-up in a single fold, so this is linear in the size of the tree.
 * Memory-typed and unknown-typed operands have no width; they are allowed only
 * as the memory operand of a load or store.
 */
public class VerifyBitSizes implements InPlaceIRPass<Expression> {
    public static final VerifyBitSizes INSTANCE = new VerifyBitSizes();

    @Override
    public void runInPlace(Expression expr) {
        Trees.<Expression, Integer>fold(expr, VerifyBitSizes::check);
    }

    @Nullable
    private static Integer check(Expression node, List<Integer> widths) {
        if (node instanceof Expression.Var) {
            return widthOf(((Expression.Var) node).variable.type);
        } else if (node instanceof Expression.Const) {
            return ((Expression.Const) node).value.width();
        } else if (node instanceof Expression.Load) {
            need(node, widths.get(1), "address");
            return ((Expression.Load) node).size;
        } else if (node instanceof Expression.Store) {
            need(node, widths.get(1), "address");
            need(node, widths.get(2), "value");
            return 0;
        } else if (node instanceof Expression.BinOp) {
            Expression.BinOp binOp = (Expression.BinOp) node;
            int lhs = need(node, widths.get(0), "lhs");
            int rhs = need(node, widths.get(1), "rhs");
            if (!binOp.op.isShift() && lhs != rhs) {
                throw fail(node, "operand widths differ: " + lhs + " and " + rhs);
            }
            return binOp.op.isComparison() ? 1 : lhs;
        } else if (node instanceof Expression.UnOp) {
            return need(node, widths.get(0), "arg");
        } else if (node instanceof Expression.Cast) {
            Expression.Cast cast = (Expression.Cast) node;
            int arg = need(node, widths.get(0), "arg");
            if (cast.kind == CastType.HIGH || cast.kind == CastType.LOW) {
                if (cast.width > arg) {
                    throw fail(node, cast.kind + " cast widens " + arg + " bits to " + cast.width);
                }
                if (cast.kind == CastType.HIGH && cast.width % 8 != 0) {
                    throw fail(node, "high cast width " + cast.width + " is not byte-aligned");
                }
            }
            return cast.width;
        } else if (node instanceof Expression.Let) {
            throw fail(node, "let-bindings must be replaced before widths are checked");
        } else if (node instanceof Expression.Unknown) {
            return widthOf(((Expression.Unknown) node).type);
        } else if (node instanceof Expression.IfThenElse) {
            int cond = need(node, widths.get(0), "condition");
            int t = need(node, widths.get(1), "true branch");
            int f = need(node, widths.get(2), "false branch");
            if (cond != 1) throw fail(node, "condition is " + cond + " bits wide");
            if (t != f) throw fail(node, "branch widths differ: " + t + " and " + f);
            return t;
        } else if (node instanceof Expression.Extract) {
            Expression.Extract extract = (Expression.Extract) node;
            int arg = need(node, widths.get(0), "arg");
            if (extract.lowBit > extract.highBit || extract.highBit > arg) {
                throw fail(node, "bit range " + extract.lowBit + ".." + extract.highBit
                        + " is out of bounds for " + arg + " bits");
            }
            return extract.highBit - extract.lowBit;
        } else if (node instanceof Expression.Concat) {
            return need(node, widths.get(0), "left") + need(node, widths.get(1), "right");
        }
        throw new IllegalArgumentException("unknown expression: " + node.getClass());
    }

    @Nullable
    private static Integer widthOf(Type type) {
        return type.hasBitSize() ? type.bitSize() : null;
    }

    private static int need(Expression node, @Nullable Integer width, String what) {
        if (width == null) throw fail(node, what + " has no width");
        return width;
    }

    private static IllegalStateException fail(Expression node, String message) {
        String s = node.toString();
        if (s.length() > 120) s = s.substring(0, 117) + "...";
        return new IllegalStateException(message + " in " + s);
    }

    @Override
    public String toString() {
        return "verify-bit-sizes";
    }
}
