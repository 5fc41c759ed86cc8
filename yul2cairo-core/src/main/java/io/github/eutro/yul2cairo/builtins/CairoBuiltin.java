package io.github.eutro.yul2cairo.builtins;

import io.github.eutro.yul2cairo.passes.convert.Implicits;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A builtin implemented by a Cairo function imported from a library module.
 */
public class CairoBuiltin implements BuiltinHandler {
    private final String module;
    private final String function;
    private final Set<String> implicits;

    public CairoBuiltin(String module, String function, String... implicits) {
        this.module = module;
        this.function = function;
        this.implicits = Implicits.of(implicits);
    }

    @Override
    public String getFunctionCall(List<String> args) {
        return function + "(" + String.join(", ", args) + ")";
    }

    @Override
    public Map<String, Set<String>> requiredImports() {
        return Collections.singletonMap(module, Collections.singleton(function));
    }

    @Override
    public Set<String> getUsedImplicits() {
        return implicits;
    }

    @Override
    public String toString() {
        return module + "." + function;
    }
}
