/**
 * Passes that convert from the lifted expression language into the analysis IR.
 */
package io.github.eutro.bil2ir.passes.convert;
