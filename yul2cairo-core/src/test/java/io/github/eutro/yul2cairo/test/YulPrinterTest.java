package io.github.eutro.yul2cairo.test;

import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.ir.YulMapper;
import io.github.eutro.yul2cairo.ir.YulPrinter;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.yul2cairo.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class YulPrinterTest {
    private static Yul.Block sample() {
        return new Yul.Block(
                fn("f", names("a"), names("r"),
                        new Yul.VariableDeclaration(Collections.singletonList(new Yul.TypedName("s", "felt")), null),
                        new Yul.If(id("a"), new Yul.Block(assign("r", new Yul.Literal("q\"")))),
                        new Yul.Switch(id("a"), Arrays.asList(
                                new Yul.Case(lit(0), new Yul.Block(new Yul.Leave())),
                                new Yul.Case(null, new Yul.Block()))),
                        new Yul.ForLoop(new Yul.Block(), new Yul.Literal(true), new Yul.Block(),
                                new Yul.Block(new Yul.Break(), new Yul.Continue()))),
                stmt("f", lit(1))
        );
    }

    @Test
    void testPrint() {
        assertEquals("{\n"
                + "    function f(a) -> r {\n"
                + "        let s:felt\n"
                + "        if a {\n"
                + "            r := \"q\\\"\"\n"
                + "        }\n"
                + "        switch a\n"
                + "        case 0 {\n"
                + "            leave\n"
                + "        }\n"
                + "        default { }\n"
                + "        for { } true { } {\n"
                + "            break\n"
                + "            continue\n"
                + "        }\n"
                + "    }\n"
                + "    f(1)\n"
                + "}", YulPrinter.print(sample()));
    }

    @Test
    void testMapperCopies() {
        Yul.Block block = sample();
        Yul.Node copy = new YulMapper().map(block);
        assertNotSame(block, copy);
        assertEquals(block.toString(), copy.toString());
    }

    @Test
    void testMapperOverride() {
        Yul.Node renamed = new YulMapper() {
            @Override
            public Yul.Node visitIdentifier(Yul.Identifier node) {
                return new Yul.Identifier(node.name.toUpperCase());
            }
        }.map(new Yul.Block(assign("x", call("add", id("y"), lit(1)))));
        assertEquals("{\n    X := ADD(Y, 1)\n}", renamed.toString());
    }
}
