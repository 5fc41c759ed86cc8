/**
 * Passes that remove code from a Yul unit without changing its behaviour.
 */
package io.github.eutro.yul2cairo.passes.opts;
