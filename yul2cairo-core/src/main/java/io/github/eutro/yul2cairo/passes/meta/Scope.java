package io.github.eutro.yul2cairo.passes.meta;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * How a block interacts with the variables of its enclosing scope.
 *
 * @see ComputeScopes
 */
public final class Scope {
    /**
     * Outer variables whose incoming value the block may observe.
     */
    public final SortedSet<String> readVariables;
    /**
     * Outer variables the block may assign to.
     */
    public final SortedSet<String> modifiedVariables;

    public Scope(SortedSet<String> readVariables, SortedSet<String> modifiedVariables) {
        this.readVariables = Collections.unmodifiableSortedSet(new TreeSet<>(readVariables));
        this.modifiedVariables = Collections.unmodifiableSortedSet(new TreeSet<>(modifiedVariables));
    }

    @Override
    public String toString() {
        return "Scope{read=" + readVariables + ", modified=" + modifiedVariables + '}';
    }
}
