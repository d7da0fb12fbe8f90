/**
 * {@link io.github.eutro.bil2ir.passes.IRPass IR passes} that combine other passes.
 */
package io.github.eutro.bil2ir.passes.misc;
