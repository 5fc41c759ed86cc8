package io.github.eutro.yul2cairo.passes.form;

import io.github.eutro.yul2cairo.ext.YulExts;
import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.passes.meta.ComputeScopes;
import io.github.eutro.yul2cairo.passes.meta.Scope;
import io.github.eutro.yul2cairo.util.F;

import java.util.*;

/**
 * Closure conversion: turns a block into a function of the variables it reads,
 * returning the variables it modifies, and a statement that calls it in place of the block.
 * <p>
 * Parameters and arguments share one order, as do return variables and assignment targets.
 * Both are sorted by name.
 */
public class ExtractBlock {
    private static final String PLACEHOLDER = "__warp_placeholder";

    private ExtractBlock() {
    }

    /**
     * The result of extracting a block.
     */
    public static final class Extraction {
        public final Yul.FunctionDefinition function;
        public final Yul.Assignment call;

        Extraction(Yul.FunctionDefinition function, Yul.Assignment call) {
            this.function = function;
            this.call = call;
        }
    }

    /**
     * The parameters and return variables of an extracted block.
     */
    public static final class Signature {
        public final List<String> parameters;
        public final List<String> returns;

        Signature(Collection<String> parameters, Collection<String> returns) {
            this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
            this.returns = Collections.unmodifiableList(new ArrayList<>(returns));
        }

        /**
         * Compute the signature a block would be extracted with.
         *
         * @param block    The block.
         * @param hasLeave Whether the block may leave the enclosing function part way through,
         *                 in which case everything it modifies is also passed in.
         * @return The signature.
         */
        public static Signature of(Yul.Block block, boolean hasLeave) {
            Scope scope = block.getExtOrRun(YulExts.SCOPE, block, ComputeScopes.INSTANCE);
            SortedSet<String> params = new TreeSet<>(scope.readVariables);
            if (hasLeave) {
                params.addAll(scope.modifiedVariables);
            }
            return new Signature(params, scope.modifiedVariables);
        }

        public Yul.Assignment makeCall(String name) {
            return new Yul.Assignment(
                    Yul.identifiers(returns),
                    new Yul.FunctionCall(new Yul.Identifier(name), Yul.identifiers(parameters))
            );
        }

        public Yul.FunctionDefinition makeFunction(String name, Yul.Block body) {
            return new Yul.FunctionDefinition(
                    name,
                    Yul.typedNames(parameters),
                    Yul.typedNames(returns),
                    body
            );
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Signature signature = (Signature) o;
            return parameters.equals(signature.parameters) && returns.equals(signature.returns);
        }

        @Override
        public int hashCode() {
            return Objects.hash(parameters, returns);
        }

        @Override
        public String toString() {
            return parameters + " -> " + returns;
        }
    }

    /**
     * Extract a block into a function.
     *
     * @param block    The block to extract.
     * @param name     The name of the new function.
     * @param hasLeave Whether the block contains a {@code leave} for the enclosing function.
     * @return The function and the statement to replace the block with.
     */
    public static Extraction extract(Yul.Block block, String name, boolean hasLeave) {
        Signature signature = Signature.of(block, hasLeave);
        return new Extraction(signature.makeFunction(name, block), signature.makeCall(name));
    }

    /**
     * Extract a block that contains a call to the function being extracted.
     * <p>
     * The template is instantiated first with a placeholder that reads and writes nothing,
     * to find the signature, and then with the real call built from that signature.
     *
     * @param template Builds the block, given the statement that calls the extracted function.
     * @param name     The name of the new function.
     * @param hasLeave Whether the block contains a {@code leave} for the enclosing function.
     * @return The function and the statement to replace the block with.
     * @throws IllegalStateException If the real call changes the signature of the block.
     */
    public static Extraction extractRecursive(F<Yul.Statement, Yul.Block> template, String name, boolean hasLeave) {
        Yul.Block skeleton = template.apply(placeholder());
        Signature signature = Signature.of(skeleton, hasLeave);

        Yul.Assignment call = signature.makeCall(name);
        Yul.Block body = template.apply(call);
        Signature actual = Signature.of(body, hasLeave);
        if (!signature.equals(actual)) {
            throw new IllegalStateException("Signature of " + name + " changed from " + signature
                    + " to " + actual + " when the placeholder was replaced");
        }
        return new Extraction(signature.makeFunction(name, body), call);
    }

    private static Yul.Statement placeholder() {
        return new Yul.Assignment(Collections.emptyList(), new Yul.FunctionCall(PLACEHOLDER));
    }
}
