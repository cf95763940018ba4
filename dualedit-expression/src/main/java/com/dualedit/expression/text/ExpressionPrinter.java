package com.dualedit.expression.text;

import com.dualedit.expression.ast.ConstantNode;
import com.dualedit.expression.ast.FunctionCallNode;
import com.dualedit.expression.ast.GroupingNode;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.ast.IntermediateNodeVisitor;
import com.dualedit.expression.ast.Operator;
import com.dualedit.expression.ast.OperatorNode;
import com.dualedit.expression.ast.Order;
import com.dualedit.expression.ast.SymbolNode;

import java.util.StringJoiner;

/**
 * Generates text from a tree. Each node is rendered with its {@link Order}; an operand is wrapped in
 * parentheses only when its order exceeds what {@link Operator#operandContext(int)} accepts, so text
 * generated from a parsed tree reparses to an equal tree. {@link GroupingNode}s always print their
 * parentheses.
 */
public final class ExpressionPrinter {

    static final String OVERFLOW_LITERAL = "1e999";

    public String print(IntermediateNode node) {
        if (node == null) {
            return "";
        }
        return node.accept(new Renderer()).code;
    }

    /** Display form of a number; integral values print without a fraction. */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Number as it appears in expression text. Infinite values have no literal of their own and print as an
     * exponent that overflows back to the same value.
     */
    static String formatLiteral(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? OVERFLOW_LITERAL : "-" + OVERFLOW_LITERAL;
        }
        return formatNumber(value);
    }

    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private record Rendered(String code, Order order) {
    }

    private static final class Renderer implements IntermediateNodeVisitor<Rendered> {

        @Override
        public Rendered visitConstant(ConstantNode node) {
            switch (node.getType()) {
                case STRING:
                    return new Rendered(quote((String) node.getValue()), Order.ATOMIC);
                case BOOLEAN:
                    return new Rendered(node.getValue().toString(), Order.ATOMIC);
                default:
                    double value = node.getNumber();
                    String code = formatLiteral(value);
                    return new Rendered(code, code.startsWith("-") ? Order.UNARY : Order.ATOMIC);
            }
        }

        @Override
        public Rendered visitSymbol(SymbolNode node) {
            return new Rendered(node.getName(), Order.ATOMIC);
        }

        @Override
        public Rendered visitGrouping(GroupingNode node) {
            return new Rendered("(" + node.getContent().accept(this).code + ")", Order.ATOMIC);
        }

        @Override
        public Rendered visitFunctionCall(FunctionCallNode node) {
            StringJoiner args = new StringJoiner(", ", node.getName() + "(", ")");
            for (IntermediateNode arg : node.getArguments()) {
                args.add(arg.accept(this).code);
            }
            return new Rendered(args.toString(), Order.FUNCTION_CALL);
        }

        @Override
        public Rendered visitOperator(OperatorNode node) {
            Operator op = node.getOperator();
            if (op.isUnary()) {
                String operand = operand(node, 0);
                String code = op == Operator.NOT
                        ? "not " + operand
                        : "-" + (operand.startsWith("-") ? " " : "") + operand;
                return new Rendered(code, op.order());
            }
            if (op == Operator.CONDITIONAL) {
                return new Rendered(operand(node, 0) + " ? " + operand(node, 1) + " : " + operand(node, 2), op.order());
            }
            return new Rendered(operand(node, 0) + " " + op.symbol() + " " + operand(node, 1), op.order());
        }

        private String operand(OperatorNode node, int index) {
            Rendered r = node.getOperand(index).accept(this);
            return r.order.needsParenthesesIn(node.getOperator().operandContext(index)) ? "(" + r.code + ")" : r.code;
        }
    }
}
