package io.github.eutro.yul2cairo.ir;

import io.github.eutro.yul2cairo.ext.ExtHolder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.*;

/**
 * The Yul IR, as produced by the parser and the earlier lowering passes.
 * <p>
 * Nodes are immutable; passes that change the tree build new nodes. The set of node
 * kinds is closed: every kind has a method in {@link Visitor}, so a traversal that
 * implements the visitor handles every kind.
 * <p>
 * {@link Switch}, {@link Case}, {@link ForLoop}, {@link Break} and {@link Continue}
 * only exist until the control flow elimination passes have run.
 */
public final class Yul {
    /**
     * The type given to variables with no explicit type.
     */
    public static final String DEFAULT_TYPE = "Uint256";

    private Yul() {
    }

    /**
     * A visitor over every kind of Yul node.
     *
     * @param <R> The result of visiting a node.
     */
    public interface Visitor<R> {
        R visitTypedName(TypedName node);

        R visitLiteral(Literal node);

        R visitIdentifier(Identifier node);

        R visitFunctionCall(FunctionCall node);

        R visitExpressionStatement(ExpressionStatement node);

        R visitAssignment(Assignment node);

        R visitVariableDeclaration(VariableDeclaration node);

        R visitBlock(Block node);

        R visitFunctionDefinition(FunctionDefinition node);

        R visitIf(If node);

        R visitCase(Case node);

        R visitSwitch(Switch node);

        R visitForLoop(ForLoop node);

        R visitBreak(Break node);

        R visitContinue(Continue node);

        R visitLeave(Leave node);
    }

    public static abstract class Node extends ExtHolder {
        public abstract <R> R accept(Visitor<R> visitor);

        @Override
        public String toString() {
            return YulPrinter.print(this);
        }
    }

    public static abstract class Expression extends Node {
    }

    public static abstract class Statement extends Node {
    }

    private static <T> List<T> freeze(List<? extends T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    public static final class TypedName extends Node {
        public final String name;
        public final String type;

        public TypedName(String name, String type) {
            this.name = Objects.requireNonNull(name);
            this.type = Objects.requireNonNull(type);
        }

        public TypedName(String name) {
            this(name, DEFAULT_TYPE);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTypedName(this);
        }
    }

    /**
     * A literal: a {@link BigInteger}, a {@link Boolean}, or a short byte string.
     */
    public static final class Literal extends Expression {
        public final Object value;

        private Literal(Object value) {
            this.value = value;
        }

        public Literal(BigInteger value) {
            this((Object) Objects.requireNonNull(value));
        }

        public Literal(long value) {
            this(BigInteger.valueOf(value));
        }

        public Literal(boolean value) {
            this((Object) value);
        }

        public Literal(String value) {
            this((Object) Objects.requireNonNull(value));
        }

        public boolean isString() {
            return value instanceof String;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    public static final class Identifier extends Expression {
        public final String name;

        public Identifier(String name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    public static final class FunctionCall extends Expression {
        public final Identifier functionName;
        public final List<Expression> arguments;

        public FunctionCall(Identifier functionName, List<? extends Expression> arguments) {
            this.functionName = Objects.requireNonNull(functionName);
            this.arguments = freeze(arguments);
        }

        public FunctionCall(String functionName, Expression... arguments) {
            this(new Identifier(functionName), Arrays.asList(arguments));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    /**
     * An expression evaluated for its effects. Only function calls are meaningful here.
     */
    public static final class ExpressionStatement extends Statement {
        public final Expression expression;

        public ExpressionStatement(Expression expression) {
            this.expression = Objects.requireNonNull(expression);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpressionStatement(this);
        }
    }

    public static final class Assignment extends Statement {
        public final List<Identifier> variableNames;
        public final Expression value;

        public Assignment(List<? extends Identifier> variableNames, Expression value) {
            this.variableNames = freeze(variableNames);
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    public static final class VariableDeclaration extends Statement {
        public final List<TypedName> variables;
        @Nullable
        public final Expression value;

        public VariableDeclaration(List<? extends TypedName> variables, @Nullable Expression value) {
            this.variables = freeze(variables);
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableDeclaration(this);
        }
    }

    public static final class Block extends Statement {
        public final List<Statement> statements;

        public Block(List<? extends Statement> statements) {
            this.statements = freeze(statements);
        }

        public Block(Statement... statements) {
            this(Arrays.asList(statements));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    public static final class FunctionDefinition extends Statement {
        public final String name;
        public final List<TypedName> parameters;
        public final List<TypedName> returnVariables;
        public final Block body;

        public FunctionDefinition(
                String name,
                List<? extends TypedName> parameters,
                List<? extends TypedName> returnVariables,
                Block body
        ) {
            this.name = Objects.requireNonNull(name);
            this.parameters = freeze(parameters);
            this.returnVariables = freeze(returnVariables);
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDefinition(this);
        }
    }

    public static final class If extends Statement {
        public final Expression condition;
        public final Block body;
        @Nullable
        public final Block elseBody;

        public If(Expression condition, Block body, @Nullable Block elseBody) {
            this.condition = Objects.requireNonNull(condition);
            this.body = Objects.requireNonNull(body);
            this.elseBody = elseBody;
        }

        public If(Expression condition, Block body) {
            this(condition, body, null);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    public static final class Case extends Node {
        /**
         * The value matched, or null for the default case.
         */
        @Nullable
        public final Literal value;
        public final Block body;

        public Case(@Nullable Literal value, Block body) {
            this.value = value;
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCase(this);
        }
    }

    public static final class Switch extends Statement {
        public final Expression expression;
        public final List<Case> cases;

        public Switch(Expression expression, List<? extends Case> cases) {
            this.expression = Objects.requireNonNull(expression);
            this.cases = freeze(cases);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSwitch(this);
        }
    }

    public static final class ForLoop extends Statement {
        public final Block pre;
        public final Expression condition;
        public final Block post;
        public final Block body;

        public ForLoop(Block pre, Expression condition, Block post, Block body) {
            this.pre = Objects.requireNonNull(pre);
            this.condition = Objects.requireNonNull(condition);
            this.post = Objects.requireNonNull(post);
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForLoop(this);
        }
    }

    public static final class Break extends Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    public static final class Continue extends Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }

    /**
     * Exits the enclosing function, returning the current values of its return variables.
     */
    public static final class Leave extends Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLeave(this);
        }
    }

    // construction helpers, mostly for passes that synthesise code

    @NotNull
    public static List<Identifier> identifiers(Collection<String> names) {
        List<Identifier> ids = new ArrayList<>(names.size());
        for (String name : names) {
            ids.add(new Identifier(name));
        }
        return ids;
    }

    @NotNull
    public static List<TypedName> typedNames(Collection<String> names) {
        List<TypedName> tns = new ArrayList<>(names.size());
        for (String name : names) {
            tns.add(new TypedName(name));
        }
        return tns;
    }
}
