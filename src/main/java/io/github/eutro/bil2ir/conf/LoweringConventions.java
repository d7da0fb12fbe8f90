package io.github.eutro.bil2ir.conf;

import io.github.eutro.bil2ir.bil.Expression;
import io.github.eutro.bil2ir.ir.IrExpression;
import io.github.eutro.bil2ir.passes.IRPass;
import io.github.eutro.bil2ir.passes.convert.BilToIr;
import io.github.eutro.bil2ir.passes.form.ReplaceLetBindings;
import io.github.eutro.bil2ir.passes.meta.VerifyBitSizes;

/**
 * Configures the pipeline from lifted expressions to analysis IR.
 */
public class LoweringConventions {
    public static final IRPass<Expression, IrExpression> DEFAULT = createBuilder().build();

    public static Builder createBuilder() {
        return new Builder();
    }

    public static class Builder {
        private boolean replaceLetBindings = true;
        private boolean verifyBitSizes = false;

        /**
         * Set whether let-bindings are replaced before lowering. Defaults to {@code true}.
         * <p>
         * Turn this off only for input already known to be let-free.
         *
         * @param replaceLetBindings Whether to replace let-bindings.
         * @return This builder.
         */
        public Builder setReplaceLetBindings(boolean replaceLetBindings) {
            this.replaceLetBindings = replaceLetBindings;
            return this;
        }

        /**
         * Set whether widths are checked before lowering. Defaults to {@code false}.
         *
         * @param verifyBitSizes Whether to check widths.
         * @return This builder.
         * @see VerifyBitSizes
         */
        public Builder setVerifyBitSizes(boolean verifyBitSizes) {
            this.verifyBitSizes = verifyBitSizes;
            return this;
        }

        public IRPass<Expression, IrExpression> build() {
            IRPass<Expression, IrExpression> pass = BilToIr.INSTANCE;
            if (verifyBitSizes) pass = VerifyBitSizes.INSTANCE.then(pass);
            if (replaceLetBindings) pass = ReplaceLetBindings.INSTANCE.then(pass);
            return pass;
        }
    }
}
