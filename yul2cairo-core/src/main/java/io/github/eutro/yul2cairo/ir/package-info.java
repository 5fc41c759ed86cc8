/**
 * The Yul IR consumed by the backend, and generic ways to traverse it.
 *
 * @see io.github.eutro.yul2cairo.ir.Yul
 */
package io.github.eutro.yul2cairo.ir;
