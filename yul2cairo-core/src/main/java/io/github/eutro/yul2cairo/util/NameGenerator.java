package io.github.eutro.yul2cairo.util;

import java.util.HashMap;
import java.util.Map;

/**
 * Supplies fresh names for functions and variables synthesised by passes.
 * <p>
 * Names have the form {@code __warp_<prefix>_<n>}, with a separate counter per prefix.
 * The {@code __warp_} prefix is reserved by the frontend, so names only need to be
 * unique among each other.
 */
public class NameGenerator {
    private final Map<String, Integer> counters = new HashMap<>();

    public String makeName(String prefix) {
        int n = counters.merge(prefix, 1, Integer::sum) - 1;
        return "__warp_" + prefix + "_" + n;
    }

    public String makeBlockName() {
        return makeName("block");
    }
}
