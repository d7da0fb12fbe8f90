/**
 * Passes that put lifted expressions into the form later passes expect.
 */
package io.github.eutro.bil2ir.passes.form;
