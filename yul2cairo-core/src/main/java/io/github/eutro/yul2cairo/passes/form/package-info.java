/**
 * Passes and transformations that change the shape of Yul code.
 */
package io.github.eutro.yul2cairo.passes.form;
