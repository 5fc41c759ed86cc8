package io.github.eutro.yul2cairo.test;

import io.github.eutro.yul2cairo.ir.Yul;

import java.util.Arrays;
import java.util.Collections;

class Utils {
    static Yul.Identifier id(String name) {
        return new Yul.Identifier(name);
    }

    static Yul.Literal lit(long value) {
        return new Yul.Literal(value);
    }

    static Yul.FunctionCall call(String name, Yul.Expression... args) {
        return new Yul.FunctionCall(name, args);
    }

    static Yul.ExpressionStatement stmt(String name, Yul.Expression... args) {
        return new Yul.ExpressionStatement(call(name, args));
    }

    static Yul.VariableDeclaration let(String name, Yul.Expression value) {
        return new Yul.VariableDeclaration(Collections.singletonList(new Yul.TypedName(name)), value);
    }

    static Yul.Assignment assign(String name, Yul.Expression value) {
        return new Yul.Assignment(Collections.singletonList(id(name)), value);
    }

    static Yul.FunctionDefinition fn(String name, String[] params, String[] returns, Yul.Statement... body) {
        return new Yul.FunctionDefinition(
                name,
                Yul.typedNames(Arrays.asList(params)),
                Yul.typedNames(Arrays.asList(returns)),
                new Yul.Block(body)
        );
    }

    static Yul.FunctionDefinition fn(String name, Yul.Statement... body) {
        return fn(name, new String[0], new String[0], body);
    }

    static String[] names(String... names) {
        return names;
    }
}
