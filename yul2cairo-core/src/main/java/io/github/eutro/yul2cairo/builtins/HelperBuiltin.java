package io.github.eutro.yul2cairo.builtins;

import io.github.eutro.yul2cairo.passes.convert.Implicits;
import io.github.eutro.yul2cairo.util.F;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A builtin implemented by a helper function generated into the output, see {@link CairoFunctions}.
 * <p>
 * The helper is only defined once a call to it is rendered.
 */
public class HelperBuiltin implements BuiltinHandler {
    private final CairoFunctions functions;
    private final F<CairoFunctions, String> define;
    private final Set<String> implicits;

    public HelperBuiltin(CairoFunctions functions, F<CairoFunctions, String> define, String... implicits) {
        this.functions = functions;
        this.define = define;
        this.implicits = Implicits.of(implicits);
    }

    @Override
    public String getFunctionCall(List<String> args) {
        return define.apply(functions) + "(" + String.join(", ", args) + ")";
    }

    @Override
    public Map<String, Set<String>> requiredImports() {
        return Collections.emptyMap();
    }

    @Override
    public Set<String> getUsedImplicits() {
        return implicits;
    }
}
