package io.github.eutro.yul2cairo.test;

import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.passes.convert.Uint256Literal;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class Uint256LiteralTest {
    @TestFactory
    Stream<DynamicTest> testIntegers() {
        return Stream.of(
                BigInteger.ZERO,
                BigInteger.valueOf(42),
                Uint256Literal.UINT128_BOUND.subtract(BigInteger.ONE),
                Uint256Literal.UINT128_BOUND,
                Uint256Literal.UINT256_BOUND.subtract(BigInteger.ONE)
        ).map(value -> DynamicTest.dynamicTest(value.toString(16), () -> {
            Uint256Literal literal = Uint256Literal.ofInteger(value);
            assertEquals(value, literal.toBigInteger());
            assertTrue(literal.low.compareTo(Uint256Literal.UINT128_BOUND) < 0);
        }));
    }

    @TestFactory
    Stream<DynamicTest> testStrings() {
        return Stream.of(
                "",
                "a",
                "exactly sixteen!",
                "seventeen bytes!!",
                "thirty two bytes of string data.",
                "quote ' and \\ and ÿ"
        ).map(value -> DynamicTest.dynamicTest("'" + value + "'", () ->
                assertEquals(value, Uint256Literal.ofString(value).toByteString())));
    }

    @Test
    void testRendering() {
        assertEquals("Uint256(low=5, high=0)", Uint256Literal.ofInteger(BigInteger.valueOf(5)).render());
        assertEquals("Uint256(low=0, high=1)", Uint256Literal.ofInteger(Uint256Literal.UINT128_BOUND).render());
        assertEquals("Uint256(low='', high='hi' * 256**14)", Uint256Literal.ofString("hi").render());
        assertEquals("Uint256(low='x' * 256**15, high='0123456789abcdef' * 256**0)",
                Uint256Literal.ofString("0123456789abcdefx").render());
        assertEquals("Uint256(low='', high=0xa000000000000000000000000000000)",
                Uint256Literal.ofString("\n").render());
    }

    @Test
    void testLeftAlignedStrings() {
        Uint256Literal literal = Uint256Literal.ofString("a");
        assertEquals(BigInteger.ZERO, literal.low);
        assertEquals(BigInteger.valueOf('a').shiftLeft(15 * 8), literal.high);
    }

    @Test
    void testBooleans() {
        assertEquals(Uint256Literal.ofInteger(BigInteger.ONE).render(),
                Uint256Literal.of(new Yul.Literal(true)).render());
        assertEquals(Uint256Literal.ofInteger(BigInteger.ZERO).render(),
                Uint256Literal.of(new Yul.Literal(false)).render());
    }

    @Test
    void testOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> Uint256Literal.ofInteger(BigInteger.valueOf(-1)));
        assertThrows(IllegalArgumentException.class, () -> Uint256Literal.ofInteger(Uint256Literal.UINT256_BOUND));
        char[] chars = new char[33];
        Arrays.fill(chars, 'x');
        assertThrows(IllegalArgumentException.class, () -> Uint256Literal.ofString(new String(chars)));
        assertThrows(IllegalArgumentException.class, () -> Uint256Literal.ofString("\u20ac"));
    }
}
