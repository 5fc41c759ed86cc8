package io.github.eutro.yul2cairo.ir;

import io.github.eutro.yul2cairo.ir.Yul.*;

import java.util.List;
import java.util.StringJoiner;

/**
 * Renders Yul nodes back to Yul source, for diagnostics and for comparing trees.
 * <p>
 * Structurally equal trees print the same. The converse does not quite hold: a name
 * given the default type explicitly prints like one left untyped.
 */
public class YulPrinter implements Visitor<String> {
    private static final YulPrinter INSTANCE = new YulPrinter();
    private static final String INDENT = "    ";

    public static String print(Node node) {
        return node.accept(INSTANCE);
    }

    private String join(List<? extends Node> nodes) {
        StringJoiner sj = new StringJoiner(", ");
        for (Node node : nodes) {
            sj.add(node.accept(this));
        }
        return sj.toString();
    }

    private static String indent(String text) {
        return INDENT + text.replace("\n", "\n" + INDENT);
    }

    @Override
    public String visitTypedName(TypedName node) {
        if (Yul.DEFAULT_TYPE.equals(node.type)) return node.name;
        return node.name + ":" + node.type;
    }

    @Override
    public String visitLiteral(Literal node) {
        if (node.isString()) {
            return "\"" + ((String) node.value).replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        return node.value.toString();
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name;
    }

    @Override
    public String visitFunctionCall(FunctionCall node) {
        return node.functionName.name + "(" + join(node.arguments) + ")";
    }

    @Override
    public String visitExpressionStatement(ExpressionStatement node) {
        return node.expression.accept(this);
    }

    @Override
    public String visitAssignment(Assignment node) {
        return join(node.variableNames) + " := " + node.value.accept(this);
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration node) {
        String decl = "let " + join(node.variables);
        if (node.value == null) return decl;
        return decl + " := " + node.value.accept(this);
    }

    @Override
    public String visitBlock(Block node) {
        if (node.statements.isEmpty()) return "{ }";
        StringBuilder sb = new StringBuilder("{\n");
        for (Statement statement : node.statements) {
            sb.append(indent(statement.accept(this))).append('\n');
        }
        return sb.append('}').toString();
    }

    @Override
    public String visitFunctionDefinition(FunctionDefinition node) {
        StringBuilder sb = new StringBuilder("function ")
                .append(node.name)
                .append('(').append(join(node.parameters)).append(')');
        if (!node.returnVariables.isEmpty()) {
            sb.append(" -> ").append(join(node.returnVariables));
        }
        return sb.append(' ').append(node.body.accept(this)).toString();
    }

    @Override
    public String visitIf(If node) {
        String text = "if " + node.condition.accept(this) + " " + node.body.accept(this);
        if (node.elseBody == null) return text;
        return text + " else " + node.elseBody.accept(this);
    }

    @Override
    public String visitCase(Case node) {
        return (node.value == null ? "default" : "case " + node.value.accept(this))
                + " " + node.body.accept(this);
    }

    @Override
    public String visitSwitch(Switch node) {
        StringBuilder sb = new StringBuilder("switch ").append(node.expression.accept(this));
        for (Case aCase : node.cases) {
            sb.append('\n').append(aCase.accept(this));
        }
        return sb.toString();
    }

    @Override
    public String visitForLoop(ForLoop node) {
        return "for " + node.pre.accept(this)
                + " " + node.condition.accept(this)
                + " " + node.post.accept(this)
                + " " + node.body.accept(this);
    }

    @Override
    public String visitBreak(Break node) {
        return "break";
    }

    @Override
    public String visitContinue(Continue node) {
        return "continue";
    }

    @Override
    public String visitLeave(Leave node) {
        return "leave";
    }
}
