package io.github.eutro.yul2cairo.passes.meta;

import io.github.eutro.yul2cairo.ext.YulExts;
import io.github.eutro.yul2cairo.ir.Yul;
import io.github.eutro.yul2cairo.ir.YulScanner;
import io.github.eutro.yul2cairo.passes.InPlaceIRPass;

import java.util.*;

/**
 * Computes the {@link Scope} of a block and attaches it as {@link YulExts#SCOPE}.
 * <p>
 * A variable is <i>outer</i> if it is not declared anywhere inside the block.
 * An outer variable is read if an identifier refers to it before it has been definitely
 * assigned, in straight-line order. An outer variable is modified if it is the target
 * of an assignment. A modified variable that is not definitely assigned by the end of
 * the block is also read, since its incoming value may flow out unchanged.
 * <p>
 * Nested function definitions are opaque: Yul functions cannot see the variables
 * around them.
 */
public class ComputeScopes implements InPlaceIRPass<Yul.Block> {
    public static final ComputeScopes INSTANCE = new ComputeScopes();

    @Override
    public void runInPlace(Yul.Block block) {
        ScopeScanner scanner = new ScopeScanner();
        scanner.scan(block);
        SortedSet<String> read = new TreeSet<>(scanner.read);
        for (String var : scanner.modified) {
            if (!scanner.assigned.contains(var)) {
                read.add(var);
            }
        }
        block.attachExt(YulExts.SCOPE, new Scope(read, scanner.modified));
    }

    private static class ScopeScanner extends YulScanner {
        final Deque<Set<String>> declared = new ArrayDeque<>();
        final SortedSet<String> read = new TreeSet<>();
        final SortedSet<String> modified = new TreeSet<>();
        Set<String> assigned = new HashSet<>();

        private boolean isLocal(String name) {
            for (Set<String> frame : declared) {
                if (frame.contains(name)) return true;
            }
            return false;
        }

        @Override
        public Void visitIdentifier(Yul.Identifier node) {
            if (!isLocal(node.name) && !assigned.contains(node.name)) {
                read.add(node.name);
            }
            return null;
        }

        @Override
        public Void visitAssignment(Yul.Assignment node) {
            scan(node.value);
            for (Yul.Identifier target : node.variableNames) {
                if (!isLocal(target.name)) {
                    modified.add(target.name);
                    assigned.add(target.name);
                }
            }
            return null;
        }

        @Override
        public Void visitVariableDeclaration(Yul.VariableDeclaration node) {
            if (node.value != null) scan(node.value);
            Set<String> frame = declared.peek();
            if (frame == null) {
                throw new IllegalStateException("Variable declaration outside of any block");
            }
            for (Yul.TypedName variable : node.variables) {
                frame.add(variable.name);
            }
            return null;
        }

        @Override
        public Void visitBlock(Yul.Block node) {
            declared.push(new HashSet<>());
            try {
                return super.visitBlock(node);
            } finally {
                declared.pop();
            }
        }

        @Override
        public Void visitFunctionDefinition(Yul.FunctionDefinition node) {
            return null;
        }

        @Override
        public Void visitIf(Yul.If node) {
            scan(node.condition);
            Set<String> before = new HashSet<>(assigned);
            scan(node.body);
            if (node.elseBody == null) {
                assigned = before;
            } else {
                Set<String> afterThen = assigned;
                assigned = new HashSet<>(before);
                scan(node.elseBody);
                assigned.retainAll(afterThen);
                assigned.addAll(before);
            }
            return null;
        }

        @Override
        public Void visitSwitch(Yul.Switch node) {
            scan(node.expression);
            Set<String> before = assigned;
            for (Yul.Case aCase : node.cases) {
                assigned = new HashSet<>(before);
                scan(aCase);
            }
            assigned = before;
            return null;
        }

        @Override
        public Void visitForLoop(Yul.ForLoop node) {
            // variables declared in pre are visible in the whole loop
            declared.push(new HashSet<>());
            try {
                for (Yul.Statement statement : node.pre.statements) {
                    scan(statement);
                }
                scan(node.condition);
                Set<String> before = new HashSet<>(assigned);
                scan(node.body);
                scan(node.post);
                assigned = before;
            } finally {
                declared.pop();
            }
            return null;
        }
    }
}
