package io.github.eutro.yul2cairo.test;

import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.passes.meta.CallGraph;
import io.github.eutro.yul2cairo.passes.meta.ComputeCallGraph;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.TreeSet;

import static io.github.eutro.yul2cairo.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class CallGraphTest {
    @Test
    void testCalleesIncludeNestedCalls() {
        Yul.Block block = new Yul.Block(
                fn("a",
                        new Yul.If(call("b"), new Yul.Block(stmt("add", call("c"), lit(1))))),
                fn("b"),
                fn("c", stmt("c")),
                stmt("a")
        );
        CallGraph graph = ComputeCallGraph.INSTANCE.run(block);
        assertEquals(new TreeSet<>(Arrays.asList("b", "c")), graph.calleesOf("a"));
        assertEquals(Collections.emptySet(), graph.calleesOf("b"));
        assertEquals(Collections.singleton("c"), graph.calleesOf("c"));
        assertThrows(IllegalArgumentException.class, () -> graph.calleesOf("add"));
        assertEquals(3, graph.functions().size());
        assertSame(block.statements.get(1), graph.getFunction("b"));
        assertNull(graph.getFunction("add"));
    }

    @Test
    void testReachabilityWithCycles() {
        Yul.Block block = new Yul.Block(
                fn("a", stmt("b")),
                fn("b", stmt("a"), stmt("c")),
                fn("c", stmt("b")),
                fn("d", stmt("a"))
        );
        CallGraph graph = ComputeCallGraph.INSTANCE.run(block);
        assertEquals(new TreeSet<>(Arrays.asList("a", "b", "c")),
                graph.reachableFrom(Arrays.asList("a", "missing")));
        assertEquals(Collections.emptySet(), graph.reachableFrom(Collections.singleton("missing")));
    }

    @Test
    void testDuplicateDefinitions() {
        Yul.Block block = new Yul.Block(fn("a"), fn("a"));
        assertThrows(IllegalStateException.class, () -> ComputeCallGraph.INSTANCE.run(block));
    }
}
