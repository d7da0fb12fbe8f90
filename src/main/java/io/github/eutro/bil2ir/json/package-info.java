/**
 * The JSON format the lifter emits lifted expressions in, read and written with Jackson.
 *
 * @see io.github.eutro.bil2ir.json.BilJson
 */
package io.github.eutro.bil2ir.json;
