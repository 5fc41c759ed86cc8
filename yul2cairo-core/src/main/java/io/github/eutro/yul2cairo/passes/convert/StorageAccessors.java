package io.github.eutro.yul2cairo.passes.convert;

import io.github.eutro.yul2cairo.ir.Yul;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises storage variable accessors by name and synthesises direct reads and writes for them.
 * <p>
 * A getter is named {@code get_<var>} or {@code [fun_]get[_]<var>_getter}, a setter
 * {@code set_<var>} or {@code [fun_]set[_]<var>_setter}. The body of an accessor
 * is never translated; its parameters are the storage keys, followed, for setters,
 * by the value to store.
 */
public final class StorageAccessors {
    private static final Pattern GETTER = Pattern.compile("(?:fun_)?get_?(\\w+?)_getter|get_(\\w+)");
    private static final Pattern SETTER = Pattern.compile("(?:fun_)?set_?(\\w+?)_setter|set_(\\w+)");

    /**
     * The implicits every accessor uses, whatever its body says.
     */
    public static final SortedSet<String> IMPLICITS = Implicits.of(
            Implicits.PEDERSEN_PTR,
            Implicits.RANGE_CHECK_PTR,
            Implicits.SYSCALL_PTR
    );

    private StorageAccessors() {
    }

    @Nullable
    private static String match(Pattern pattern, String name) {
        Matcher m = pattern.matcher(name);
        if (!m.matches()) return null;
        return m.group(1) != null ? m.group(1) : m.group(2);
    }

    @Nullable
    public static String getterVariable(String functionName) {
        return match(GETTER, functionName);
    }

    @Nullable
    public static String setterVariable(String functionName) {
        return match(SETTER, functionName);
    }

    /**
     * Whether a function name marks it as a storage accessor, which must survive pruning
     * since it is reachable from outside the contract.
     *
     * @param functionName The function name.
     * @return Whether it is an accessor.
     */
    public static boolean isAccessorName(String functionName) {
        return functionName.contains("getter")
                || functionName.contains("setter")
                || getterVariable(functionName) != null
                || setterVariable(functionName) != null;
    }

    /**
     * A synthesised accessor.
     */
    public static final class Accessor {
        public final StorageVar storageVar;
        public final String body;

        Accessor(StorageVar storageVar, String body) {
            this.storageVar = storageVar;
            this.body = body;
        }
    }

    /**
     * Synthesise the body of a function if it is a storage accessor.
     *
     * @param function The function definition.
     * @return The accessor, or null if the function is not named like one.
     * @throws IllegalStateException If the function is named like an accessor, but has the wrong shape.
     */
    @Nullable
    public static Accessor synthesize(Yul.FunctionDefinition function) {
        String getterVar = getterVariable(function.name);
        String setterVar = setterVariable(function.name);
        if (getterVar == null && setterVar == null) return null;

        List<String> args = new ArrayList<>();
        for (Yul.TypedName parameter : function.parameters) {
            args.add(parameter.name);
        }
        if (getterVar != null) {
            if (function.returnVariables.size() != 1) {
                throw new IllegalStateException("Storage getter " + function.name
                        + " must return exactly one value, got " + function.returnVariables.size());
            }
            List<String> keyTypes = new ArrayList<>();
            for (Yul.TypedName parameter : function.parameters) {
                keyTypes.add(parameter.type);
            }
            Yul.TypedName result = function.returnVariables.get(0);
            return new Accessor(
                    new StorageVar(getterVar, keyTypes, result.type),
                    getterBody(getterVar, args, result.name)
            );
        }
        if (function.parameters.isEmpty()) {
            throw new IllegalStateException("Storage setter " + function.name
                    + " must have at least one parameter, the value to set");
        }
        List<String> keyTypes = new ArrayList<>();
        for (Yul.TypedName parameter : function.parameters.subList(0, function.parameters.size() - 1)) {
            keyTypes.add(parameter.type);
        }
        Yul.TypedName value = function.parameters.get(function.parameters.size() - 1);
        return new Accessor(
                new StorageVar(setterVar, keyTypes, value.type),
                setterBody(setterVar, args)
        );
    }

    static String getterBody(String var, List<String> keys, String result) {
        return "let (" + result + ") = " + var + ".read(" + String.join(", ", keys) + ")\n"
                + "return (" + result + ")";
    }

    static String setterBody(String var, List<String> args) {
        return var + ".write(" + String.join(", ", args) + ")\n"
                + "return ()";
    }
}
