package io.github.eutro.yul2cairo.passes.convert;

import io.github.eutro.yul2cairo.conf.CairoConventions;
import io.github.eutro.yul2cairo.conf.Conventions;
import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.passes.IRPass;

/**
 * Translates a Yul unit into the text of a Cairo program.
 * <p>
 * Every run uses a fresh {@link CairoEmitter}, so one instance can translate many units,
 * concurrently if need be.
 */
public class YulToCairo implements IRPass<Yul.Node, String> {
    /**
     * An instance of this pass, using the default conventions.
     */
    public static final YulToCairo INSTANCE = new YulToCairo(Conventions.DEFAULT_CONVENTIONS);

    private final CairoConventions conventions;

    public YulToCairo(CairoConventions conventions) {
        this.conventions = conventions;
    }

    @Override
    public String run(Yul.Node node) {
        return new CairoEmitter(conventions).translate(node);
    }
}
