/**
 * The expression language emitted by the machine-code lifter.
 * <p>
 * Expressions are pure trees: every node owns its children, and nothing is shared.
 * A tree fresh from the lifter may contain {@link io.github.eutro.bil2ir.bil.Expression.Let}
 * bindings, which must be
 * {@link io.github.eutro.bil2ir.passes.form.ReplaceLetBindings replaced} before widths
 * are inferred or the tree is
 * {@link io.github.eutro.bil2ir.passes.convert.BilToIr lowered}.
 */
package io.github.eutro.bil2ir.bil;
