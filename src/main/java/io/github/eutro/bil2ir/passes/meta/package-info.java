/**
 * {@link io.github.eutro.bil2ir.passes.IRPass IR passes} that check, rather than change, the IR.
 */
package io.github.eutro.bil2ir.passes.meta;
