package io.github.eutro.yul2cairo.ir;

import io.github.eutro.yul2cairo.ir.Yul.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A visitor that rebuilds the tree from its mapped children.
 * <p>
 * The base implementation is an identity mapping that produces a fresh, structurally
 * equal tree. Subclasses override the kinds they want to rewrite, and call back into
 * {@link #map(Node)} for the children they keep.
 */
public class YulMapper implements Visitor<Node> {
    public Node map(Node node) {
        return node.accept(this);
    }

    public Expression mapExpression(Expression node) {
        return (Expression) map(node);
    }

    public Statement mapStatement(Statement node) {
        return (Statement) map(node);
    }

    public Block mapBlock(Block node) {
        return (Block) map(node);
    }

    protected <T extends Node> List<T> mapAll(List<T> nodes, Class<T> type) {
        List<T> mapped = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            mapped.add(type.cast(map(node)));
        }
        return mapped;
    }

    @Override
    public Node visitTypedName(TypedName node) {
        return new TypedName(node.name, node.type);
    }

    @Override
    public Node visitLiteral(Literal node) {
        return node;
    }

    @Override
    public Node visitIdentifier(Identifier node) {
        return new Identifier(node.name);
    }

    @Override
    public Node visitFunctionCall(FunctionCall node) {
        return new FunctionCall(
                (Identifier) map(node.functionName),
                mapAll(node.arguments, Expression.class)
        );
    }

    @Override
    public Node visitExpressionStatement(ExpressionStatement node) {
        return new ExpressionStatement(mapExpression(node.expression));
    }

    @Override
    public Node visitAssignment(Assignment node) {
        return new Assignment(
                mapAll(node.variableNames, Identifier.class),
                mapExpression(node.value)
        );
    }

    @Override
    public Node visitVariableDeclaration(VariableDeclaration node) {
        return new VariableDeclaration(
                mapAll(node.variables, TypedName.class),
                node.value == null ? null : mapExpression(node.value)
        );
    }

    @Override
    public Node visitBlock(Block node) {
        return new Block(mapAll(node.statements, Statement.class));
    }

    @Override
    public Node visitFunctionDefinition(FunctionDefinition node) {
        return new FunctionDefinition(
                node.name,
                mapAll(node.parameters, TypedName.class),
                mapAll(node.returnVariables, TypedName.class),
                mapBlock(node.body)
        );
    }

    @Override
    public Node visitIf(If node) {
        return new If(
                mapExpression(node.condition),
                mapBlock(node.body),
                node.elseBody == null ? null : mapBlock(node.elseBody)
        );
    }

    @Override
    public Node visitCase(Case node) {
        return new Case(node.value, mapBlock(node.body));
    }

    @Override
    public Node visitSwitch(Switch node) {
        return new Switch(mapExpression(node.expression), mapAll(node.cases, Case.class));
    }

    @Override
    public Node visitForLoop(ForLoop node) {
        return new ForLoop(
                mapBlock(node.pre),
                mapExpression(node.condition),
                mapBlock(node.post),
                mapBlock(node.body)
        );
    }

    @Override
    public Node visitBreak(Break node) {
        return new Break();
    }

    @Override
    public Node visitContinue(Continue node) {
        return new Continue();
    }

    @Override
    public Node visitLeave(Leave node) {
        return new Leave();
    }
}
