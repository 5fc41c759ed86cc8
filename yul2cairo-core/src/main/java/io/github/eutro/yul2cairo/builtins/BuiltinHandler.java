package io.github.eutro.yul2cairo.builtins;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lowers calls to one Yul builtin.
 */
public interface BuiltinHandler {
    /**
     * Render a call to this builtin.
     *
     * @param args The already rendered arguments.
     * @return The Cairo call.
     */
    String getFunctionCall(List<String> args);

    /**
     * Get the imports the rendered call needs.
     *
     * @return A map from module path to the symbols imported from it.
     */
    Map<String, Set<String>> requiredImports();

    /**
     * Get the implicit arguments the rendered call consumes.
     *
     * @return The names of the implicits, see {@link io.github.eutro.yul2cairo.passes.convert.Implicits}.
     */
    Set<String> getUsedImplicits();
}
