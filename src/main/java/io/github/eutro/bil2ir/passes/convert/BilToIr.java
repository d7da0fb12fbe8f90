package io.github.eutro.bil2ir.passes.convert;

import io.github.eutro.bil2ir.bil.CastType;
import io.github.eutro.bil2ir.bil.Expression;
import io.github.eutro.bil2ir.ir.ByteSize;
import io.github.eutro.bil2ir.ir.IrBinOpType;
import io.github.eutro.bil2ir.ir.IrCastOpType;
import io.github.eutro.bil2ir.ir.IrExpression;
import io.github.eutro.bil2ir.passes.IRPass;
import io.github.eutro.bil2ir.util.TreeWalker;
import io.github.eutro.bil2ir.util.Trees;

import java.util.List;
import java.util.logging.Logger;

/**
 * A pass which lowers a let-free, side-effect free lifted expression into the analysis IR.
 * <p>
 * Memory accesses, bindings, unknowns and conditionals have no expression form in the
 * analysis IR; they must have been removed or moved to statement level beforehand.
 * The whole input is checked before anything is built, so an unsupported node
 * anywhere in the tree fails the pass without producing any output.
 * <p>
 * Widths are converted to bytes, rounding up.
 */
public class BilToIr implements IRPass<Expression, IrExpression> {
    /**
     * An instance of this pass.
     */
    public static final BilToIr INSTANCE = new BilToIr();

    private static final Logger LOGGER = Logger.getLogger(BilToIr.class.getName());

    @Override
    public IrExpression run(Expression expr) {
        int nodes = 0;
        for (Expression node : TreeWalker.of(expr).preOrder()) {
            checkSupported(node);
            nodes++;
        }
        IrExpression lowered = Trees.fold(expr, BilToIr::lower);
        int count = nodes;
        LOGGER.fine(() -> "lowered " + count + " expression nodes");
        return lowered;
    }

    private static void checkSupported(Expression node) {
        if (node instanceof Expression.Load || node instanceof Expression.Store) {
            throw new UnsupportedOperationException("cannot lower memory access " + describe(node)
                    + ", it must be extracted to statement level first");
        } else if (node instanceof Expression.Let) {
            throw new UnsupportedOperationException("cannot lower let-binding " + describe(node)
                    + ", let-bindings must be replaced first");
        } else if (node instanceof Expression.Unknown) {
            throw new UnsupportedOperationException("cannot lower unknown expression " + describe(node));
        } else if (node instanceof Expression.IfThenElse) {
            throw new UnsupportedOperationException("cannot lower conditional " + describe(node)
                    + ", it must be flattened first");
        } else if (node instanceof Expression.Cast) {
            Expression.Cast cast = (Expression.Cast) node;
            if (cast.kind == CastType.HIGH && cast.width % 8 != 0) {
                throw new IllegalArgumentException("high cast to " + cast.width + " bits is not byte-aligned");
            }
        }
    }

    private static String describe(Expression node) {
        String s = node.toString();
        return s.length() > 120 ? s.substring(0, 117) + "..." : s;
    }

    private static IrExpression lower(Expression node, List<IrExpression> args) {
        if (node instanceof Expression.Var) {
            return new IrExpression.Var(((Expression.Var) node).variable.toIr());
        } else if (node instanceof Expression.Const) {
            return new IrExpression.Const(((Expression.Const) node).value);
        } else if (node instanceof Expression.BinOp) {
            return new IrExpression.BinOp(((Expression.BinOp) node).op.toIr(), args.get(0), args.get(1));
        } else if (node instanceof Expression.UnOp) {
            return new IrExpression.UnOp(((Expression.UnOp) node).op.toIr(), args.get(0));
        } else if (node instanceof Expression.Cast) {
            return lowerCast((Expression.Cast) node, args.get(0));
        } else if (node instanceof Expression.Extract) {
            Expression.Extract extract = (Expression.Extract) node;
            // the bit range is inclusive here, unlike in BitSizes
            return new IrExpression.Subpiece(
                    ByteSize.fromBits(extract.lowBit),
                    ByteSize.fromBits(extract.highBit - extract.lowBit + 1),
                    args.get(0));
        } else if (node instanceof Expression.Concat) {
            return new IrExpression.BinOp(IrBinOpType.PIECE, args.get(0), args.get(1));
        }
        throw new UnsupportedOperationException("cannot lower " + describe(node));
    }

    private static IrExpression lowerCast(Expression.Cast cast, IrExpression arg) {
        switch (cast.kind) {
            case UNSIGNED:
                return new IrExpression.Cast(IrCastOpType.INT_ZEXT, ByteSize.fromBits(cast.width), arg);
            case SIGNED:
                return new IrExpression.Cast(IrCastOpType.INT_SEXT, ByteSize.fromBits(cast.width), arg);
            case HIGH:
                return new IrExpression.Subpiece(
                        ByteSize.fromBits(cast.arg.bitSize() - cast.width),
                        ByteSize.fromBits(cast.width),
                        arg);
            case LOW:
                return new IrExpression.Subpiece(ByteSize.ZERO, ByteSize.fromBits(cast.width), arg);
            default:
                throw new AssertionError(cast.kind);
        }
    }

    @Override
    public String toString() {
        return "bil-to-ir";
    }
}
