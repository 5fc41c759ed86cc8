/**
 * Exts: typed metadata attached to IR nodes.
 * <p>
 * An {@link io.github.eutro.yul2cairo.ext.Ext} is a key, and an
 * {@link io.github.eutro.yul2cairo.ext.ExtContainer} maps keys to values.
 * Analyses attach their results so later passes can reuse them without
 * recomputing, see {@link io.github.eutro.yul2cairo.ext.ExtContainer#getExtOrRun}.
 */
package io.github.eutro.yul2cairo.ext;
