package io.github.eutro.yul2cairo.passes.convert;

import java.util.*;

/**
 * A table of Cairo imports, from module path to imported symbols.
 */
public final class Imports {
    private final SortedMap<String, SortedSet<String>> table = new TreeMap<>();

    public Imports merge(Map<String, ? extends Collection<String>> imports) {
        imports.forEach((module, symbols) ->
                table.computeIfAbsent(module, $ -> new TreeSet<>()).addAll(symbols));
        return this;
    }

    public SortedMap<String, SortedSet<String>> asMap() {
        return Collections.unmodifiableSortedMap(table);
    }

    /**
     * Render the import statements, one per module, modules and symbols sorted.
     *
     * @return The import statements.
     */
    public String format() {
        StringJoiner lines = new StringJoiner("\n");
        table.forEach((module, symbols) -> {
            if (!symbols.isEmpty()) {
                lines.add("from " + module + " import " + String.join(", ", symbols));
            }
        });
        return lines.toString();
    }
}
