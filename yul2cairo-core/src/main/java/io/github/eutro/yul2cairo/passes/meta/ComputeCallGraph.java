package io.github.eutro.yul2cairo.passes.meta;

import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.ir.YulScanner;
import io.github.eutro.yul2cairo.passes.IRPass;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds the {@link CallGraph} of the functions defined directly in a top-level block.
 * <p>
 * Each function body is scanned in full, nested blocks and call arguments included.
 */
public class ComputeCallGraph implements IRPass<Yul.Block, CallGraph> {
    public static final ComputeCallGraph INSTANCE = new ComputeCallGraph();

    @Override
    public CallGraph run(Yul.Block block) {
        Map<String, Yul.FunctionDefinition> functions = new LinkedHashMap<>();
        for (Yul.Statement statement : block.statements) {
            if (statement instanceof Yul.FunctionDefinition) {
                Yul.FunctionDefinition function = (Yul.FunctionDefinition) statement;
                if (functions.put(function.name, function) != null) {
                    throw new IllegalStateException("Function " + function.name + " is defined more than once");
                }
            }
        }

        Map<String, SortedSet<String>> callees = new LinkedHashMap<>();
        for (Yul.FunctionDefinition function : functions.values()) {
            SortedSet<String> calls = new TreeSet<>();
            new YulScanner() {
                @Override
                public Void visitFunctionCall(Yul.FunctionCall node) {
                    if (functions.containsKey(node.functionName.name)) {
                        calls.add(node.functionName.name);
                    }
                    return super.visitFunctionCall(node);
                }
            }.scan(function.body);
            callees.put(function.name, calls);
        }
        return new CallGraph(functions, callees);
    }
}
