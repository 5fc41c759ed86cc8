package io.github.eutro.yul2cairo.ir;

import io.github.eutro.yul2cairo.ir.Yul.*;

/**
 * A visitor that walks the whole tree depth-first, in source order, without building anything.
 * <p>
 * Subclasses override the kinds they are interested in; calling {@code super} continues
 * into the children.
 */
public abstract class YulScanner implements Visitor<Void> {
    public void scan(Node node) {
        node.accept(this);
    }

    protected void scanAll(Iterable<? extends Node> nodes) {
        for (Node node : nodes) {
            scan(node);
        }
    }

    @Override
    public Void visitTypedName(TypedName node) {
        return null;
    }

    @Override
    public Void visitLiteral(Literal node) {
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node) {
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        scanAll(node.arguments);
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement node) {
        scan(node.expression);
        return null;
    }

    @Override
    public Void visitAssignment(Assignment node) {
        scan(node.value);
        scanAll(node.variableNames);
        return null;
    }

    @Override
    public Void visitVariableDeclaration(VariableDeclaration node) {
        if (node.value != null) scan(node.value);
        scanAll(node.variables);
        return null;
    }

    @Override
    public Void visitBlock(Block node) {
        scanAll(node.statements);
        return null;
    }

    @Override
    public Void visitFunctionDefinition(FunctionDefinition node) {
        scanAll(node.parameters);
        scanAll(node.returnVariables);
        scan(node.body);
        return null;
    }

    @Override
    public Void visitIf(If node) {
        scan(node.condition);
        scan(node.body);
        if (node.elseBody != null) scan(node.elseBody);
        return null;
    }

    @Override
    public Void visitCase(Case node) {
        if (node.value != null) scan(node.value);
        scan(node.body);
        return null;
    }

    @Override
    public Void visitSwitch(Switch node) {
        scan(node.expression);
        scanAll(node.cases);
        return null;
    }

    @Override
    public Void visitForLoop(ForLoop node) {
        scan(node.pre);
        scan(node.condition);
        scan(node.body);
        scan(node.post);
        return null;
    }

    @Override
    public Void visitBreak(Break node) {
        return null;
    }

    @Override
    public Void visitContinue(Continue node) {
        return null;
    }

    @Override
    public Void visitLeave(Leave node) {
        return null;
    }
}
