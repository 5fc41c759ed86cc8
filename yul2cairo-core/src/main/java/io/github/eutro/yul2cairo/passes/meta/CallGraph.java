package io.github.eutro.yul2cairo.passes.meta;

import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.util.GraphWalker;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The static call graph over the top-level functions of a Yul unit.
 * <p>
 * Functions are identified by name, since names are unique within a unit.
 * Calls to anything other than a top-level function (builtins, unknown names)
 * are not edges.
 *
 * @see ComputeCallGraph
 */
public final class CallGraph {
    private final Map<String, Yul.FunctionDefinition> functions;
    private final Map<String, SortedSet<String>> callees;

    CallGraph(Map<String, Yul.FunctionDefinition> functions, Map<String, SortedSet<String>> callees) {
        this.functions = functions;
        this.callees = callees;
    }

    /**
     * Get the top-level functions, in source order.
     *
     * @return The functions.
     */
    public Collection<Yul.FunctionDefinition> functions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    @Nullable
    public Yul.FunctionDefinition getFunction(String name) {
        return functions.get(name);
    }

    /**
     * Get the top-level functions called directly by the named one.
     *
     * @param name The caller.
     * @return The callees, sorted by name.
     * @throws IllegalArgumentException If there is no such top-level function.
     */
    @NotNull
    public SortedSet<String> calleesOf(String name) {
        SortedSet<String> set = callees.get(name);
        if (set == null) {
            throw new IllegalArgumentException("No top-level function named " + name);
        }
        return Collections.unmodifiableSortedSet(set);
    }

    /**
     * Compute the functions reachable from the given roots, including the roots themselves.
     * <p>
     * Roots that are not functions in this graph are ignored.
     *
     * @param roots The names to start from.
     * @return The reachable function names.
     */
    public SortedSet<String> reachableFrom(Collection<String> roots) {
        SortedSet<String> visited = new TreeSet<>();
        for (String root : roots) {
            if (!contains(root) || visited.contains(root)) continue;
            for (String name : new GraphWalker<>(root, this::calleesOf).preOrder()) {
                visited.add(name);
            }
        }
        return visited;
    }
}
