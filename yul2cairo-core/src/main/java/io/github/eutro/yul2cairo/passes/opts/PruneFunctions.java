package io.github.eutro.yul2cairo.passes.opts;

import io.github.eutro.yul2cairo.conf.CairoConventions;
import io.github.eutro.yul2cairo.conf.Conventions;
import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.passes.IRPass;
import io.github.eutro.yul2cairo.passes.convert.StorageAccessors;
import io.github.eutro.yul2cairo.passes.meta.CallGraph;
import io.github.eutro.yul2cairo.passes.meta.ComputeCallGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * An optimisation pass that removes top-level functions unreachable from the roots.
 * <p>
 * The constructor and storage accessors are always kept, since they are called from
 * outside the unit. Only the statements of the top-level block are filtered; any other
 * node is returned as is.
 */
public class PruneFunctions implements IRPass<Yul.Node, Yul.Node> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PruneFunctions.class);

    /**
     * An instance of this pass, using the default conventions.
     */
    public static final PruneFunctions INSTANCE = new PruneFunctions(Conventions.DEFAULT_CONVENTIONS);

    private final List<String> roots;
    private final String constructorName;

    public PruneFunctions(Collection<String> roots, String constructorName) {
        this.roots = Collections.unmodifiableList(new ArrayList<>(roots));
        this.constructorName = constructorName;
    }

    public PruneFunctions(CairoConventions conventions) {
        this(conventions.pruneRoots, conventions.constructorName);
    }

    @Override
    public Yul.Node run(Yul.Node node) {
        if (!(node instanceof Yul.Block)) return node;
        Yul.Block block = (Yul.Block) node;

        CallGraph graph = ComputeCallGraph.INSTANCE.run(block);
        Set<String> visited = graph.reachableFrom(roots);

        List<Yul.Statement> kept = new ArrayList<>(block.statements.size());
        List<String> pruned = new ArrayList<>();
        for (Yul.Statement statement : block.statements) {
            if (statement instanceof Yul.FunctionDefinition) {
                String name = ((Yul.FunctionDefinition) statement).name;
                if (!visited.contains(name)
                        && !constructorName.equals(name)
                        && !StorageAccessors.isAccessorName(name)) {
                    pruned.add(name);
                    continue;
                }
            }
            kept.add(statement);
        }
        if (!pruned.isEmpty()) {
            LOGGER.debug("Pruned unreachable functions {}", pruned);
        }
        return new Yul.Block(kept);
    }
}
