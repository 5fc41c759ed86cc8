package io.github.eutro.yul2cairo.builtins;

import io.github.eutro.yul2cairo.passes.convert.Implicits;
import io.github.eutro.yul2cairo.passes.convert.StorageVar;
import io.github.eutro.yul2cairo.passes.convert.StorageAccessors;

import java.util.*;

/**
 * Helper Cairo functions generated on demand into the output program, and the storage
 * variables they rely on.
 * <p>
 * One instance belongs to one translation.
 */
public class CairoFunctions {
    /**
     * The storage backing Yul's {@code sload} and {@code sstore}, a flat map from word to word.
     */
    public static final StorageVar EVM_STORAGE = new StorageVar(
            "evm_storage",
            Collections.singletonList("Uint256"),
            "Uint256"
    );

    private final SortedMap<String, String> definitions = new TreeMap<>();
    private final SortedSet<StorageVar> storageVars = new TreeSet<>();

    /**
     * Define a helper function, unless one with the same name exists already.
     *
     * @param name       The function name.
     * @param definition The full function definition.
     * @return The function name.
     */
    public String define(String name, String definition) {
        definitions.putIfAbsent(name, definition);
        return name;
    }

    public String sloadFunction() {
        storageVars.add(EVM_STORAGE);
        return define("sload", "func sload" + Implicits.printAll(StorageAccessors.IMPLICITS)
                + "(key : Uint256) -> (value : Uint256):\n"
                + "    let (value) = evm_storage.read(key)\n"
                + "    return (value)\n"
                + "end\n");
    }

    public String sstoreFunction() {
        storageVars.add(EVM_STORAGE);
        return define("sstore", "func sstore" + Implicits.printAll(StorageAccessors.IMPLICITS)
                + "(key : Uint256, value : Uint256) -> ():\n"
                + "    evm_storage.write(key, value)\n"
                + "    return ()\n"
                + "end\n");
    }

    /**
     * Get the definitions of the helpers used so far, sorted by name.
     *
     * @return The definitions.
     */
    public List<String> getDefinitions() {
        return new ArrayList<>(definitions.values());
    }

    public SortedSet<StorageVar> getStorageVars() {
        return Collections.unmodifiableSortedSet(storageVars);
    }
}
