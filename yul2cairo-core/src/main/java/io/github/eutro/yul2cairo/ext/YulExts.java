package io.github.eutro.yul2cairo.ext;

import io.github.eutro.yul2cairo.passes.meta.Scope;

/**
 * Exts attached to Yul nodes.
 */
public class YulExts {
    /**
     * The variables a block reads from and writes to its enclosing scope.
     * Attached to {@link io.github.eutro.yul2cairo.ir.Yul.Block}s by
     * {@link io.github.eutro.yul2cairo.passes.meta.ComputeScopes}.
     */
    public static final Ext<Scope> SCOPE = Ext.create(Scope.class, "SCOPE");
}
