package io.github.eutro.bil2ir.passes;

import io.github.eutro.bil2ir.bil.Expression;
import io.github.eutro.bil2ir.ir.IrExpression;
import io.github.eutro.bil2ir.passes.convert.BilToIr;
import io.github.eutro.bil2ir.passes.form.ReplaceLetBindings;
import io.github.eutro.bil2ir.passes.meta.VerifyBitSizes;

/**
 * Ready-made pipelines from lifted expressions to analysis IR.
 *
 * @see io.github.eutro.bil2ir.conf.LoweringConventions
 */
public class Passes {
    /**
     * Replace let-bindings, then lower.
     */
    public static final IRPass<Expression, IrExpression> LOWER =
            ReplaceLetBindings.INSTANCE
                    .then(BilToIr.INSTANCE);

    /**
     * Replace let-bindings, check widths, then lower.
     */
    public static final IRPass<Expression, IrExpression> CHECKED_LOWER =
            ReplaceLetBindings.INSTANCE
                    .then(VerifyBitSizes.INSTANCE)
                    .then(BilToIr.INSTANCE);
}
