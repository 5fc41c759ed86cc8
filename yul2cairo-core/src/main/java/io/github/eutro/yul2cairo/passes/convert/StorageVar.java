package io.github.eutro.yul2cairo.passes.convert;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A Starknet storage variable, keyed by zero or more values.
 */
public final class StorageVar implements Comparable<StorageVar> {
    public final String name;
    public final List<String> keyTypes;
    public final String valueType;

    public StorageVar(String name, List<String> keyTypes, String valueType) {
        this.name = Objects.requireNonNull(name);
        this.keyTypes = Collections.unmodifiableList(new ArrayList<>(keyTypes));
        this.valueType = Objects.requireNonNull(valueType);
    }

    /**
     * Render the {@code @storage_var} declaration of this variable.
     *
     * @return The declaration.
     */
    public String declaration() {
        StringJoiner args = new StringJoiner(", ");
        for (int i = 0; i < keyTypes.size(); i++) {
            args.add("arg" + i + " : " + keyTypes.get(i));
        }
        return "@storage_var\n"
                + "func " + name + "(" + args + ") -> (res : " + valueType + "):\n"
                + "end\n";
    }

    @Override
    public int compareTo(@NotNull StorageVar o) {
        return name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StorageVar that = (StorageVar) o;
        return name.equals(that.name) && keyTypes.equals(that.keyTypes) && valueType.equals(that.valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, keyTypes, valueType);
    }

    @Override
    public String toString() {
        return name + keyTypes + " -> " + valueType;
    }
}
