package io.github.eutro.yul2cairo.conf;

import io.github.eutro.yul2cairo.builtins.BuiltinHandler;
import io.github.eutro.yul2cairo.builtins.Builtins;
import io.github.eutro.yul2cairo.builtins.CairoFunctions;
import io.github.eutro.yul2cairo.util.F;

import java.util.*;

/**
 * The naming and calling conventions the backend lowers against.
 * <p>
 * Instances are immutable; use {@link Conventions#createBuilder()} to make one.
 */
public final class CairoConventions {
    public final String entryPointName;
    public final String constructorName;
    /**
     * Functions whose name starts with this run inside the constructor's context,
     * so they clean up the same way the constructor does when terminating.
     */
    public final String constructorHelperPrefix;
    /**
     * Functions that are always live when pruning.
     */
    public final List<String> pruneRoots;
    public final F<CairoFunctions, Map<String, BuiltinHandler>> builtins;
    public final String preamble;
    public final Map<String, Set<String>> baseImports;

    private CairoConventions(Builder builder) {
        entryPointName = builder.entryPointName;
        constructorName = builder.constructorName;
        constructorHelperPrefix = builder.constructorHelperPrefix;
        pruneRoots = builder.pruneRoots == null
                ? Collections.unmodifiableList(Arrays.asList(entryPointName, constructorName))
                : Collections.unmodifiableList(new ArrayList<>(builder.pruneRoots));
        builtins = builder.builtins;
        preamble = builder.preamble;
        Map<String, Set<String>> imports = new TreeMap<>();
        builder.baseImports.forEach((module, symbols) ->
                imports.put(module, Collections.unmodifiableSet(new TreeSet<>(symbols))));
        baseImports = Collections.unmodifiableMap(imports);
    }

    public boolean isEntryPoint(String name) {
        return entryPointName.equals(name);
    }

    public boolean isConstructor(String name) {
        return constructorName.equals(name);
    }

    public boolean isConstructorHelper(String name) {
        return name.startsWith(constructorHelperPrefix);
    }

    public static class Builder {
        private String entryPointName = "fun_ENTRY_POINT";
        private String constructorName = "constructor";
        private String constructorHelperPrefix = "fun_warp_constructor";
        private List<String> pruneRoots = null;
        private F<CairoFunctions, Map<String, BuiltinHandler>> builtins = Builtins::defaultHandlers;
        private String preamble = "%lang starknet\n%builtins pedersen range_check bitwise\n";
        private final Map<String, Set<String>> baseImports = new TreeMap<>();

        Builder() {
            addBaseImports("starkware.cairo.common.registers", "get_fp_and_pc");
            addBaseImports("starkware.cairo.common.dict_access", "DictAccess");
            addBaseImports("starkware.cairo.common.default_dict", "default_dict_new", "default_dict_finalize");
            addBaseImports("starkware.cairo.common.uint256", "Uint256");
            addBaseImports("starkware.cairo.common.cairo_builtins", "HashBuiltin", "BitwiseBuiltin");
            addBaseImports("starkware.cairo.common.alloc", "alloc");
            addBaseImports("evm.exec_env", "ExecutionEnvironment");
        }

        public Builder setEntryPointName(String entryPointName) {
            this.entryPointName = entryPointName;
            return this;
        }

        public Builder setConstructorName(String constructorName) {
            this.constructorName = constructorName;
            return this;
        }

        public Builder setConstructorHelperPrefix(String constructorHelperPrefix) {
            this.constructorHelperPrefix = constructorHelperPrefix;
            return this;
        }

        /**
         * Set the functions pruning starts from. Defaults to the entry point and the constructor.
         *
         * @param pruneRoots The root function names.
         * @return This builder.
         */
        public Builder setPruneRoots(Collection<String> pruneRoots) {
            this.pruneRoots = new ArrayList<>(pruneRoots);
            return this;
        }

        public Builder setBuiltins(F<CairoFunctions, Map<String, BuiltinHandler>> builtins) {
            this.builtins = builtins;
            return this;
        }

        public Builder setPreamble(String preamble) {
            this.preamble = preamble;
            return this;
        }

        public Builder addBaseImports(String module, String... symbols) {
            baseImports.computeIfAbsent(module, $ -> new TreeSet<>())
                    .addAll(Arrays.asList(symbols));
            return this;
        }

        public CairoConventions build() {
            return new CairoConventions(this);
        }
    }
}
