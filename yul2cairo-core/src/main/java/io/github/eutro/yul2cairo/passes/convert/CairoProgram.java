package io.github.eutro.yul2cairo.passes.convert;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Assembles the parts of a translated program into its final text.
 */
public final class CairoProgram {
    private CairoProgram() {
    }

    /**
     * Concatenate the program parts, in order: preamble, imports, helper definitions,
     * storage variable declarations and the translated code.
     *
     * @param preamble    The directives that start the file.
     * @param imports     The imports.
     * @param helpers     Helper function definitions.
     * @param storageVars Storage variables, declared in name order.
     * @param body        The translated code.
     * @return The program.
     */
    public static String assemble(
            String preamble,
            Imports imports,
            List<String> helpers,
            Collection<StorageVar> storageVars,
            String body
    ) {
        List<String> parts = new ArrayList<>();
        parts.add(preamble);
        parts.add(imports.format());
        parts.add("");
        parts.addAll(helpers);
        parts.add("");
        for (StorageVar storageVar : new TreeSet<>(storageVars)) {
            parts.add(storageVar.declaration());
        }
        parts.add(body);
        return String.join("\n", parts);
    }

    static String indent(String text) {
        StringBuilder sb = new StringBuilder();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i != 0) sb.append('\n');
            if (!lines[i].isEmpty()) sb.append("    ").append(lines[i]);
        }
        return sb.toString();
    }
}
