package io.github.eutro.yul2cairo.passes;

import io.github.eutro.yul2cairo.conf.CairoConventions;
import io.github.eutro.yul2cairo.conf.Conventions;
import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.passes.convert.YulToCairo;
import io.github.eutro.yul2cairo.passes.opts.PruneFunctions;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Prune and translate a unit with the default conventions.
     */
    public static final IRPass<Yul.Node, String> LOWER_TO_CAIRO = lowerToCairo(Conventions.DEFAULT_CONVENTIONS);

    public static IRPass<Yul.Node, String> lowerToCairo(CairoConventions conventions) {
        return new PruneFunctions(conventions)
                .then(new YulToCairo(conventions));
    }
}
